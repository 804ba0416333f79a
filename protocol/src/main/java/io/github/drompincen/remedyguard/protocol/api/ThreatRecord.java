package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A detected threat as submitted by the caller. The {@code additionalInfo} node is
 * copied on the way in and on the way out so the record stays immutable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ThreatRecord(
        @JsonProperty("threat_id") String threatId,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("sha256") String sha256,
        @JsonProperty("description") String description,
        @JsonProperty("additional_info") JsonNode additionalInfo
) {
    public ThreatRecord {
        additionalInfo = additionalInfo != null ? additionalInfo.deepCopy() : null;
    }

    public static ThreatRecord of(String threatId, String description) {
        return new ThreatRecord(threatId, null, null, description, null);
    }

    @Override
    @JsonProperty("additional_info")
    public JsonNode additionalInfo() {
        return additionalInfo != null ? additionalInfo.deepCopy() : null;
    }
}
