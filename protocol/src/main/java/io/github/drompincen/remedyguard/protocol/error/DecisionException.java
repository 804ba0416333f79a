package io.github.drompincen.remedyguard.protocol.error;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;

import java.util.Optional;

/**
 * Base of every failure a decision attempt can surface. When the attempt got as far as
 * the audit log, {@link #decision()} holds the record that was written for it.
 */
public class DecisionException extends RuntimeException {

    private final DecisionErrorKind kind;
    private final DecisionRecord decision;

    public DecisionException(DecisionErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public DecisionException(DecisionErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public DecisionException(DecisionErrorKind kind, String message, DecisionRecord decision, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.decision = decision;
    }

    public DecisionErrorKind kind() {
        return kind;
    }

    public Optional<DecisionRecord> decision() {
        return Optional.ofNullable(decision);
    }
}
