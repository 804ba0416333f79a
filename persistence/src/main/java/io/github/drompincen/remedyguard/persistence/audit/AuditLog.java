package io.github.drompincen.remedyguard.persistence.audit;

import io.github.drompincen.remedyguard.protocol.api.AuditEntry;
import io.github.drompincen.remedyguard.protocol.api.AuditVerifyReport;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.error.AuditWriteException;

import java.util.List;

/**
 * Append-only store of decision records.
 */
public interface AuditLog {

    /**
     * Appends one decision as a single atomic unit and returns once it is durable.
     *
     * @throws AuditWriteException if the record could not be written; the caller must then
     *                             treat the decision attempt as failed
     */
    AuditEntry append(DecisionRecord decision);

    List<AuditEntry> entries();

    AuditVerifyReport verify();

    String describe();

    default List<AuditEntry> latest(int limit) {
        List<AuditEntry> all = entries();
        if (limit <= 0 || all.size() <= limit) return all;
        return all.subList(all.size() - limit, all.size());
    }
}
