package com.actionguard.gateway.api.dto;

/**
 * Request body for POST /environments/{env}/restore.
 * snapshot is a name as listed by GET /environments/{env}/snapshots.
 */
public record RestoreRequest(String snapshot) {}
