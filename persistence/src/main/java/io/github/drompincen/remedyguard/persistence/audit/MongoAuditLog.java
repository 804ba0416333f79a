package io.github.drompincen.remedyguard.persistence.audit;

import io.github.drompincen.remedyguard.persistence.document.AuditEntryDocument;
import io.github.drompincen.remedyguard.persistence.repository.AuditEntryRepository;
import io.github.drompincen.remedyguard.protocol.api.AuditEntry;
import io.github.drompincen.remedyguard.protocol.api.AuditVerifyReport;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.error.AuditWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Audit log stored in the {@code audit_entries} collection. The unique index on
 * {@code seq} makes a second writer fail instead of forking the chain.
 */
@Service
@ConditionalOnProperty(name = "remedyguard.audit.sink", havingValue = "mongo")
public class MongoAuditLog implements AuditLog {

    private static final Logger log = LoggerFactory.getLogger(MongoAuditLog.class);

    private final AuditEntryRepository repository;
    private final ReentrantLock writeLock = new ReentrantLock();

    // null until loaded from the collection
    private AuditEntry tail;
    private boolean tailLoaded;

    public MongoAuditLog(AuditEntryRepository repository) {
        this.repository = repository;
    }

    @Override
    public AuditEntry append(DecisionRecord decision) {
        Objects.requireNonNull(decision, "decision");
        writeLock.lock();
        try {
            if (!tailLoaded) {
                tail = repository.findTopByOrderBySeqDesc().map(MongoAuditLog::toEntry).orElse(null);
                tailLoaded = true;
            }
            long previousSeq = tail != null ? tail.seq() : 0;
            String previousHash = tail != null ? tail.hash() : AuditChain.GENESIS_HASH;
            AuditEntry entry = AuditChain.next(previousSeq, previousHash, decision);
            repository.save(toDocument(entry));
            tail = entry;
            return entry;
        } catch (DataAccessException e) {
            // the tail may have moved under us; reload it on the next append
            tailLoaded = false;
            log.error("Failed to append audit entry for threat {}: {}", decision.threatId(), e.getMessage(), e);
            throw new AuditWriteException("Failed to append audit entry for threat " + decision.threatId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<AuditEntry> entries() {
        return repository.findAllByOrderBySeqAsc().stream().map(MongoAuditLog::toEntry).toList();
    }

    @Override
    public AuditVerifyReport verify() {
        return AuditChain.verify(entries(), List.of());
    }

    @Override
    public String describe() {
        return "mongo:audit_entries";
    }

    static AuditEntryDocument toDocument(AuditEntry entry) {
        DecisionRecord d = entry.decision();
        AuditEntryDocument doc = new AuditEntryDocument();
        doc.setEntryId(UUID.randomUUID().toString());
        doc.setSeq(entry.seq());
        doc.setPrevHash(entry.prevHash());
        doc.setHash(entry.hash());
        doc.setThreatId(d.threatId());
        doc.setRecommendation(d.recommendation());
        doc.setDestructive(d.destructive());
        doc.setApproved(d.approved());
        doc.setNotes(d.notes());
        doc.setTimestamp(d.timestamp());
        return doc;
    }

    static AuditEntry toEntry(AuditEntryDocument doc) {
        DecisionRecord decision = new DecisionRecord(doc.getThreatId(), doc.getRecommendation(),
                doc.isDestructive(), doc.isApproved(), doc.getNotes(), doc.getTimestamp());
        return new AuditEntry(doc.getSeq(), doc.getPrevHash(), doc.getHash(), decision);
    }
}
