package com.actionguard.gateway.api.dto;

import com.actionguard.gateway.service.PlanReview;

import java.util.List;

/**
 * Response body for POST /plans/analyze.
 * approvalRequired tells the caller whether POST /batches will need "APPROVE".
 */
public record AnalysisResponse(
        String           env,
        String           risk,
        List<String>     reasons,
        List<ActionView> actions,
        boolean          approvalRequired) {

    public static AnalysisResponse from(PlanReview review) {
        return new AnalysisResponse(
                review.env().id(),
                review.analysis().risk().label(),
                review.analysis().reasons(),
                review.actions().stream().map(ActionView::from).toList(),
                review.approvalRequired());
    }
}
