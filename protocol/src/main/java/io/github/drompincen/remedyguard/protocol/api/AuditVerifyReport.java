package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AuditVerifyReport(
        @JsonProperty("total") int total,
        @JsonProperty("ok") int ok,
        @JsonProperty("bad") int bad,
        @JsonProperty("first_bad_seq") Long firstBadSeq,
        @JsonProperty("latest_hash") String latestHash,
        @JsonProperty("issues") List<AuditIssue> issues
) {
    public AuditVerifyReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean intact() {
        return bad == 0;
    }
}
