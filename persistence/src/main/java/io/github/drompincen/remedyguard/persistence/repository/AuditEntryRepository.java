package io.github.drompincen.remedyguard.persistence.repository;

import io.github.drompincen.remedyguard.persistence.document.AuditEntryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface AuditEntryRepository extends MongoRepository<AuditEntryDocument, String> {
    Optional<AuditEntryDocument> findTopByOrderBySeqDesc();
    List<AuditEntryDocument> findAllByOrderBySeqAsc();
    List<AuditEntryDocument> findByThreatIdOrderBySeqAsc(String threatId);
}
