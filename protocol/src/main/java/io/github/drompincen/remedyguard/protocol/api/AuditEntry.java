package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A decision as stored in the audit log, linked to its predecessor by hash.
 */
public record AuditEntry(
        @JsonProperty("seq") long seq,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("hash") String hash,
        @JsonProperty("decision") DecisionRecord decision
) {}
