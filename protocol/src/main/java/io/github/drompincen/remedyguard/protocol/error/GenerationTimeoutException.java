package io.github.drompincen.remedyguard.protocol.error;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;

import java.time.Duration;

public class GenerationTimeoutException extends GenerationException {

    private final Duration timeout;

    public GenerationTimeoutException(Duration timeout) {
        this(timeout, null, null);
    }

    public GenerationTimeoutException(Duration timeout, DecisionRecord decision, Throwable cause) {
        super(DecisionErrorKind.GENERATION_TIMEOUT, "Generation timed out after " + timeout.toMillis() + " ms", decision, cause);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
