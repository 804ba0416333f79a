package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RecommendRequest(
        @JsonProperty("threat") ThreatRecord threat,
        @JsonProperty("confirm") boolean confirm
) {}
