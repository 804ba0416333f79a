package io.github.drompincen.remedyguard.protocol.error;

/** The audit log refused or failed an append; the decision it carried does not count. */
public class AuditWriteException extends DecisionException {

    public AuditWriteException(String message) {
        super(DecisionErrorKind.AUDIT_WRITE_ERROR, message);
    }

    public AuditWriteException(String message, Throwable cause) {
        super(DecisionErrorKind.AUDIT_WRITE_ERROR, message, cause);
    }
}
