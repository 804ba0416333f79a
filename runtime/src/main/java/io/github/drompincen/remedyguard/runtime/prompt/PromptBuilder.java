package io.github.drompincen.remedyguard.runtime.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.remedyguard.protocol.api.ThreatRecord;
import io.github.drompincen.remedyguard.protocol.error.InputException;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Turns a threat into the system and user text sent to the generation backend. The
 * whole record, extra fields included, is rendered as indented JSON in the user text.
 */
@Component
public class PromptBuilder {

    static final String SYSTEM_INSTRUCTIONS = "You are a cybersecurity assistant specialized in AV/EDR.";

    static final String USER_INSTRUCTIONS = """
            Provide a concise recommendation that includes what to do, why it matters, \
            and if it is destructive (mention 'delete', 'remove', 'kill', etc.). \
            Return the recommendation in a single paragraph.""";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public GenerationPrompt build(ThreatRecord threat) {
        if (threat == null) {
            throw new InputException("threat is required");
        }
        ObjectNode data = MAPPER.createObjectNode();
        data.put("threat_id", threat.threatId());
        data.put("file_path", threat.filePath());
        data.put("sha256", threat.sha256());
        data.put("description", threat.description());
        JsonNode extra = threat.additionalInfo();
        if (extra == null || extra.isNull()) {
            data.putNull("additional_info");
        } else {
            if (!extra.isObject()) {
                throw new InputException("additional_info must be an object, got " + extra.getNodeType());
            }
            requireSupportedValues("additional_info", extra);
            data.set("additional_info", extra);
        }

        String json;
        try {
            json = MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new InputException("Threat data is not serializable: " + e.getOriginalMessage(), e);
        }
        return new GenerationPrompt(SYSTEM_INSTRUCTIONS, "Threat Data:\n" + json + "\n\n" + USER_INSTRUCTIONS);
    }

    // additional_info values: string, number, boolean or a nested object of the same
    private static void requireSupportedValues(String path, JsonNode node) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldPath = path + "." + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                requireSupportedValues(fieldPath, value);
            } else if (!value.isTextual() && !value.isNumber() && !value.isBoolean()) {
                throw new InputException(fieldPath + " has unsupported type " + value.getNodeType()
                        + "; expected string, number, boolean or object");
            }
        }
    }
}
