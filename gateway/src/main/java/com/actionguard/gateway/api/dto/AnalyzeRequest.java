package com.actionguard.gateway.api.dto;

/**
 * Request body for POST /plans/analyze and POST /plans/report.
 */
public record AnalyzeRequest(String plan, String env) {}
