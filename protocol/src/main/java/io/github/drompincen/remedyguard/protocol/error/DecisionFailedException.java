package io.github.drompincen.remedyguard.protocol.error;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;

/** A fault outside the known taxonomy, raised after the attempt was logged as failed. */
public class DecisionFailedException extends DecisionException {

    public DecisionFailedException(String message, DecisionRecord decision, Throwable cause) {
        super(DecisionErrorKind.INTERNAL_ERROR, message, decision, cause);
    }
}
