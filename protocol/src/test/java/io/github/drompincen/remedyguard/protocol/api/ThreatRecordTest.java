package io.github.drompincen.remedyguard.protocol.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThreatRecordTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void deserializesSnakeCaseFields() throws Exception {
        String json = """
                {"threat_id": "malware-001", "file_path": "/tmp/x.exe", "sha256": "abc",
                 "description": "ransomware encrypting /home",
                 "additional_info": {"host": "ws-12", "score": 97, "active": true}}""";

        ThreatRecord threat = mapper.readValue(json, ThreatRecord.class);

        assertThat(threat.threatId()).isEqualTo("malware-001");
        assertThat(threat.filePath()).isEqualTo("/tmp/x.exe");
        assertThat(threat.sha256()).isEqualTo("abc");
        assertThat(threat.description()).isEqualTo("ransomware encrypting /home");
        assertThat(threat.additionalInfo().get("score").asInt()).isEqualTo(97);
    }

    @Test
    void additionalInfoKeepsInsertionOrder() throws Exception {
        String json = """
                {"threat_id": "t1", "additional_info": {"zeta": "1", "alpha": "2", "mid": "3"}}""";

        ThreatRecord threat = mapper.readValue(json, ThreatRecord.class);

        List<String> names = new ArrayList<>();
        threat.additionalInfo().fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactly("zeta", "alpha", "mid");
    }

    @Test
    void additionalInfoCannotBeMutatedThroughTheRecord() {
        ObjectNode extra = mapper.createObjectNode().put("host", "ws-12");
        ThreatRecord threat = new ThreatRecord("t1", null, null, null, extra);

        extra.put("host", "changed");
        ((ObjectNode) threat.additionalInfo()).put("host", "changed-again");

        assertThat(threat.additionalInfo().get("host").asText()).isEqualTo("ws-12");
    }

    @Test
    void serializationOmitsAbsentFields() throws Exception {
        String json = mapper.writeValueAsString(ThreatRecord.of("t1", "suspicious"));

        assertThat(json).contains("\"threat_id\":\"t1\"").contains("\"description\":\"suspicious\"");
        assertThat(json).doesNotContain("file_path").doesNotContain("additional_info");
    }
}
