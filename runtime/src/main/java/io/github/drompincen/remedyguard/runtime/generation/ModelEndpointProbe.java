package io.github.drompincen.remedyguard.runtime.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Checks that the OpenAI-compatible endpoint answers {@code GET /v1/models}. The result
 * is cached so status polling does not hammer the backend.
 */
@Component
@ConditionalOnProperty(name = "remedyguard.llm.provider", havingValue = "openai", matchIfMissing = true)
public class ModelEndpointProbe {

    private static final Logger log = LoggerFactory.getLogger(ModelEndpointProbe.class);

    private final RestClient restClient;
    private final String baseUrl;
    private final Duration cacheFor;
    private final Clock clock;

    private Boolean lastResult;
    private Instant checkedAt;

    @Autowired
    public ModelEndpointProbe(@Value("${remedyguard.llm.base-url:http://localhost:11434}") String baseUrl,
                              @Value("${remedyguard.llm.api-key:ollama}") String apiKey,
                              @Value("${remedyguard.llm.probe-timeout:2s}") Duration timeout,
                              @Value("${remedyguard.llm.probe-cache:30s}") Duration cacheFor,
                              Clock clock) {
        this(RestClient.builder()
                        .baseUrl(baseUrl)
                        .requestFactory(requestFactory(timeout))
                        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                        .build(),
                baseUrl, cacheFor, clock);
    }

    ModelEndpointProbe(RestClient restClient, String baseUrl, Duration cacheFor, Clock clock) {
        this.restClient = restClient;
        this.baseUrl = baseUrl;
        this.cacheFor = cacheFor;
        this.clock = clock;
    }

    public synchronized boolean isReachable() {
        Instant now = clock.instant();
        if (lastResult != null && checkedAt.plus(cacheFor).isAfter(now)) {
            return lastResult;
        }
        lastResult = ping();
        checkedAt = now;
        return lastResult;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }

    private boolean ping() {
        try {
            restClient.get().uri("/v1/models").retrieve().toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.warn("Model endpoint {} is not reachable: {}", baseUrl, e.getMessage());
            return false;
        }
    }
}
