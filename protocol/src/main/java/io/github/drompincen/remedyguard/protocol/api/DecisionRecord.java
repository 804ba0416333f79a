package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one decision attempt. The same value is appended to the audit log and
 * returned to the caller.
 */
public record DecisionRecord(
        @JsonProperty("threat_id") String threatId,
        @JsonProperty("recommendation") String recommendation,
        @JsonProperty("destructive") boolean destructive,
        @JsonProperty("approved") boolean approved,
        @JsonProperty("notes") String notes,
        @JsonProperty("timestamp") Instant timestamp
) {
    public DecisionRecord {
        if (recommendation == null) recommendation = "";
    }

    public static DecisionRecord approved(String threatId, String recommendation, boolean destructive,
                                          String notes, Instant timestamp) {
        return new DecisionRecord(threatId, recommendation, destructive, true, notes, timestamp);
    }

    public static DecisionRecord denied(String threatId, String recommendation, String notes, Instant timestamp) {
        return new DecisionRecord(threatId, recommendation, true, false, notes, timestamp);
    }

    /** A record for an attempt that never produced a usable recommendation. */
    public static DecisionRecord failed(String threatId, String notes, Instant timestamp) {
        return new DecisionRecord(threatId, "", false, false, notes, timestamp);
    }
}
