package com.actionguard.gateway.service;

import com.actionguard.gateway.audit.AuditRecord;

/**
 * What an executed batch left behind.
 *
 * @param record        the audit record as appended
 * @param checksum      checksum stored alongside it
 * @param snapshotName  pre-execution snapshot, for rollback
 */
public record BatchReport(AuditRecord record, String checksum, String snapshotName) {}
