package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AuditIssue(
        @JsonProperty("seq") long seq,
        @JsonProperty("reason") String reason
) {}
