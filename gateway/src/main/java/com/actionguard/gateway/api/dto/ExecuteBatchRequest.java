package com.actionguard.gateway.api.dto;

/**
 * Request body for POST /batches.
 *
 * Required: plan, env
 * Optional: task, approval, approverNote. approval must be "APPROVE" for any
 *   plan the analysis marks as needing approval.
 */
public record ExecuteBatchRequest(String task, String plan, String env,
                                  String approval, String approverNote) {}
