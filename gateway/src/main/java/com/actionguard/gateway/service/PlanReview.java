package com.actionguard.gateway.service;

import com.actionguard.gateway.plan.Action;
import com.actionguard.gateway.policy.Analysis;
import com.actionguard.gateway.workspace.TargetEnvironment;

import java.util.List;

/**
 * A parsed and evaluated plan, before anything runs.
 *
 * @param approvalRequired true when risk is above LOW or the target is prod
 */
public record PlanReview(
        TargetEnvironment env,
        List<Action>      actions,
        Analysis          analysis,
        boolean           approvalRequired) {}
