package io.github.drompincen.remedyguard.runtime.generation;

import io.github.drompincen.remedyguard.protocol.error.GenerationException;
import io.github.drompincen.remedyguard.runtime.prompt.GenerationPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generation through a Spring AI chat model, by default an OpenAI-compatible endpoint
 * such as a local Ollama server.
 */
@Service
@ConditionalOnProperty(name = "remedyguard.llm.provider", havingValue = "openai", matchIfMissing = true)
public class SpringAiGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerationClient.class);

    private final ChatModel chatModel;
    private final String modelName;
    private final ModelEndpointProbe endpointProbe;

    public SpringAiGenerationClient(ChatModel chatModel,
                                    @Value("${remedyguard.llm.model:gpt-oss:20b}") String modelName,
                                    ModelEndpointProbe endpointProbe) {
        this.chatModel = chatModel;
        this.modelName = modelName;
        this.endpointProbe = endpointProbe;
    }

    @Override
    public String generate(GenerationPrompt prompt) {
        List<Message> messages = List.of(new SystemMessage(prompt.system()), new UserMessage(prompt.user()));
        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(messages));
        } catch (RuntimeException e) {
            log.error("Model call to {} failed: {}", modelName, e.getMessage());
            throw new GenerationException("Model generation failed: " + e.getMessage(), e);
        }
        String text = null;
        if (response != null && response.getResult() != null && response.getResult().getOutput() != null) {
            text = response.getResult().getOutput().getText();
        }
        if (text == null || text.isBlank()) {
            throw new GenerationException("Model " + modelName + " returned an empty recommendation");
        }
        log.debug("Model {} returned {} chars", modelName, text.length());
        return text.strip();
    }

    @Override
    public boolean isAvailable() {
        return endpointProbe.isReachable();
    }

    @Override
    public String getProviderInfo() {
        return "openai-compatible:" + modelName;
    }
}
