package com.branchflow.core.engine;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates run identifiers in the format {@code yyyyMMddHHmmss-PID-N}.
 * <p>
 * The process id keeps ids from separate CLI invocations apart: each one is
 * a new JVM whose counter starts at 1, and two pipelines started in the same
 * second would otherwise both name their resolution branch
 * {@code merge-hotfix-to-dev-yyyyMMddHHmmss-1}. CI systems usually pass their
 * own build number instead.
 */
@Component
public class RunIdGenerator {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private final AtomicInteger counter = new AtomicInteger(0);
    private final Clock clock;
    private final long pid;

    @Autowired
    public RunIdGenerator(Clock clock) {
        this(clock, ProcessHandle.current().pid());
    }

    RunIdGenerator(Clock clock, long pid) {
        this.clock = clock;
        this.pid = pid;
    }

    public String next() {
        return FORMAT.format(clock.instant()) + "-" + pid + "-" + counter.incrementAndGet();
    }
}
