package io.github.drompincen.remedyguard.protocol.error;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;

/** The generation backend was unreachable, failed, or answered with nothing usable. */
public class GenerationException extends DecisionException {

    public GenerationException(String message) {
        super(DecisionErrorKind.GENERATION_ERROR, message);
    }

    public GenerationException(String message, Throwable cause) {
        super(DecisionErrorKind.GENERATION_ERROR, message, cause);
    }

    public GenerationException(String message, DecisionRecord decision, Throwable cause) {
        super(DecisionErrorKind.GENERATION_ERROR, message, decision, cause);
    }

    protected GenerationException(DecisionErrorKind kind, String message, DecisionRecord decision, Throwable cause) {
        super(kind, message, decision, cause);
    }
}
