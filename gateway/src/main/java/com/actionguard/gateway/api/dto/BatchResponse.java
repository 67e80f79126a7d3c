package com.actionguard.gateway.api.dto;

import com.actionguard.gateway.audit.AuditRecord;
import com.actionguard.gateway.service.BatchReport;

/**
 * Response body for POST /batches: the appended audit record, its checksum
 * and the snapshot to pass to /environments/{env}/restore for a rollback.
 */
public record BatchResponse(
        String      snapshot,
        String      checksum,
        boolean     allSucceeded,
        AuditRecord record) {

    public static BatchResponse from(BatchReport report) {
        return new BatchResponse(
                report.snapshotName(),
                report.checksum(),
                report.record().allSucceeded(),
                report.record());
    }
}
