package io.github.drompincen.remedyguard.runtime.gate;

/**
 * States a single decision attempt passes through. Every path ends in {@link #LOGGED}.
 */
public enum DecisionState {
    GENERATED,
    CLASSIFIED,
    AUTO_APPROVED,
    PENDING_CONFIRMATION,
    APPROVED,
    DENIED,
    FAILED,
    LOGGED
}
