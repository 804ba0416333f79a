package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.drompincen.remedyguard.protocol.error.DecisionErrorKind;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @JsonProperty("code") DecisionErrorKind code,
        @JsonProperty("message") String message,
        @JsonProperty("decision") DecisionRecord decision
) {
    public static ErrorResponse of(DecisionErrorKind code, String message) {
        return new ErrorResponse(code, message, null);
    }
}
