package com.actionguard.gateway.service;

import com.actionguard.gateway.policy.Analysis;

/**
 * Thrown when a batch needs human approval and the request did not carry it.
 * Nothing has been snapshotted or executed when this is raised.
 */
public class ApprovalRequiredException extends RuntimeException {

    private final Analysis analysis;

    public ApprovalRequiredException(Analysis analysis) {
        super("Approval required for " + analysis.risk().label() + " risk batch");
        this.analysis = analysis;
    }

    public Analysis getAnalysis() { return analysis; }
}
