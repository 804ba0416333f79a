package io.github.drompincen.remedyguard.runtime.generation;

import io.github.drompincen.remedyguard.runtime.prompt.GenerationPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Canned recommendations keyed off the threat text, for running without a model.
 *
 * Activate with: REMEDYGUARD_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "remedyguard.llm.provider", havingValue = "fake")
public class FakeGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(FakeGenerationClient.class);

    @Override
    public String generate(GenerationPrompt prompt) {
        String lower = prompt.user() == null ? "" : prompt.user().toLowerCase(Locale.ROOT);
        String response;
        if (lower.contains("ransomware") || lower.contains("encrypt")) {
            response = "Isolate the host from the network, then quarantine and delete the encrypted payload. "
                    + "Ransomware spreads laterally, so containment comes before restoring files from backup.";
        } else if (lower.contains("miner") || lower.contains("cryptojack")) {
            response = "Kill the mining process and remove its scheduled task. "
                    + "Unchecked miners degrade the host and usually indicate a wider compromise.";
        } else if (lower.contains("adware") || lower.contains("pup") || lower.contains("toolbar")) {
            response = "Uninstall the unwanted program from the affected endpoint. "
                    + "It is low risk but tracks browsing and degrades performance.";
        } else {
            response = "Quarantine the file and keep the host under observation for 24 hours. "
                    + "Evidence is inconclusive, so preserving the sample allows further analysis.";
        }
        log.debug("[FAKE LLM] response length={}", response.length());
        return response;
    }

    @Override
    public String getProviderInfo() {
        return "fake";
    }
}
