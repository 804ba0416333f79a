package io.github.drompincen.remedyguard.protocol.error;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;

/** Malformed or unserializable threat data. */
public class InputException extends DecisionException {

    public InputException(String message) {
        super(DecisionErrorKind.INPUT_ERROR, message);
    }

    public InputException(String message, Throwable cause) {
        super(DecisionErrorKind.INPUT_ERROR, message, cause);
    }

    public InputException(String message, DecisionRecord decision, Throwable cause) {
        super(DecisionErrorKind.INPUT_ERROR, message, decision, cause);
    }
}
