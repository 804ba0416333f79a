package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One decision per submitted threat, in submission order.
 */
public record BatchReport(
        @JsonProperty("report") List<DecisionRecord> report
) {
    public BatchReport {
        report = report != null ? List.copyOf(report) : List.of();
    }

    public int size() {
        return report.size();
    }

    public long approvedCount() {
        return report.stream().filter(DecisionRecord::approved).count();
    }
}
