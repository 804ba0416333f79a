package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchRequest(
        @JsonProperty("threats") List<ThreatRecord> threats
) {
    public BatchRequest {
        threats = threats != null ? List.copyOf(threats) : List.of();
    }
}
