package com.actionguard.gateway.service;

import com.actionguard.gateway.workspace.TargetEnvironment;

/**
 * Everything needed to run one batch.
 *
 * @param task          what the agent is trying to do; logged, not interpreted
 * @param plan          plan text in the action grammar
 * @param env           target environment
 * @param approval      must read "APPROVE" when the plan needs approval
 * @param approverNote  reason / intent recorded with the approval
 */
public record ExecutionRequest(
        String            task,
        String            plan,
        TargetEnvironment env,
        String            approval,
        String            approverNote) {}
