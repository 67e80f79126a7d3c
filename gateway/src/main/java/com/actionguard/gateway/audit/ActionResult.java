package com.actionguard.gateway.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one action inside an audit record.
 *
 * Stored as {@code {"action": raw line, "ok": bool, "msg": message}}.
 */
public record ActionResult(
        @JsonProperty("action") String  raw,
        @JsonProperty("ok")     boolean ok,
        @JsonProperty("msg")    String  message) {}
