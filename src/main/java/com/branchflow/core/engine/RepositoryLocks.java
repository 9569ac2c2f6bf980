package com.branchflow.core.engine;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per repository. A promotion holds the lock of its repository
 * from the first gateway call to the last, so actions against the same
 * working tree never interleave.
 */
@Component
public class RepositoryLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String repositoryKey) {
        return locks.computeIfAbsent(repositoryKey, k -> new ReentrantLock(true));
    }
}
