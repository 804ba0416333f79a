package io.github.drompincen.remedyguard.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.api.RecommendRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonConfigTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    @Test
    void timestampsAreIsoStrings() throws Exception {
        DecisionRecord decision = DecisionRecord.approved("t1", "Monitor.", false, null,
                Instant.parse("2026-10-18T09:30:00.123Z"));

        assertThat(mapper.writeValueAsString(decision)).contains("\"timestamp\":\"2026-10-18T09:30:00.123Z\"");
    }

    @Test
    void requestWithoutConfirmDefaultsToFalse() throws Exception {
        RecommendRequest request = mapper.readValue("{\"threat\":{\"threat_id\":\"t1\"}}", RecommendRequest.class);

        assertThat(request.threat().threatId()).isEqualTo("t1");
        assertThat(request.confirm()).isFalse();
    }

    @Test
    void unknownThreatFieldIsRejected() {
        assertThatThrownBy(() -> mapper.readValue(
                "{\"threat\":{\"threat_id\":\"t1\",\"severity\":9}}", RecommendRequest.class))
                .isInstanceOf(UnrecognizedPropertyException.class);
    }
}
