package io.github.drompincen.remedyguard.protocol.error;

public enum DecisionErrorKind {
    INPUT_ERROR,
    GENERATION_ERROR,
    GENERATION_TIMEOUT,
    CONFIRMATION_REQUIRED,
    AUDIT_WRITE_ERROR,
    INTERNAL_ERROR
}
