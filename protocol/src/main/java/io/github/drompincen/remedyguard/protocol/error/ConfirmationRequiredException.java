package io.github.drompincen.remedyguard.protocol.error;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;

/**
 * A destructive recommendation arrived without prior confirmation. The denial has
 * already been logged; {@link #decision()} is always present.
 */
public class ConfirmationRequiredException extends DecisionException {

    public ConfirmationRequiredException(DecisionRecord denial) {
        super(DecisionErrorKind.CONFIRMATION_REQUIRED,
                "Destructive recommendation requires explicit confirmation.", denial, null);
    }
}
