package io.github.drompincen.remedyguard.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

/**
 * Chat model for the {@code openai} provider. Any OpenAI-compatible endpoint works; the
 * defaults point at a local Ollama server.
 *
 * <p>Each generation is a single HTTP call: the model's retry template is capped at one
 * attempt so a failing backend surfaces as a generation error instead of eating the
 * gate's timeout.
 */
@Configuration
@ConditionalOnProperty(name = "remedyguard.llm.provider", havingValue = "openai", matchIfMissing = true)
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    OpenAiChatModel openAiChatModel(ObjectProvider<RestClient.Builder> restClientBuilder,
                                    @Value("${remedyguard.llm.base-url:http://localhost:11434}") String baseUrl,
                                    @Value("${remedyguard.llm.api-key:ollama}") String apiKey,
                                    @Value("${remedyguard.llm.model:gpt-oss:20b}") String model,
                                    @Value("${remedyguard.llm.temperature:0.2}") double temperature) {
        log.info("Generation backend: model={} at {}", model, baseUrl);
        return chatModel(restClientBuilder.getIfAvailable(RestClient::builder), baseUrl, apiKey, model, temperature);
    }

    static OpenAiChatModel chatModel(RestClient.Builder restClientBuilder, String baseUrl, String apiKey,
                                     String model, double temperature) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .restClientBuilder(restClientBuilder)
                .build();
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .build();
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(options)
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }
}
