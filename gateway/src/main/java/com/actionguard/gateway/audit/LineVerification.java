package com.actionguard.gateway.audit;

/**
 * Integrity check result for a single stored audit line.
 *
 * @param lineNumber  1-based line number in the log file
 * @param intact      true if the stored checksum matches the stored record
 * @param detail      "ok", or why the line failed
 */
public record LineVerification(int lineNumber, boolean intact, String detail) {}
