package com.actionguard.gateway.audit;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of the audit log: the record plus the SHA-256 of its serialized form.
 */
@JsonPropertyOrder({"checksum", "record"})
public record AuditEntry(String checksum, AuditRecord record) {}
