package com.branchflow.core.engine;

import com.branchflow.core.gateway.VcsGateway;

/**
 * Identity of one branch event being processed.
 *
 * @param runId   pipeline execution identifier, distinct per run
 * @param branch  the branch whose event triggered the run
 * @param gateway repository the run acts on
 */
public record RunContext(
    String runId,
    String branch,
    VcsGateway gateway
) {}
