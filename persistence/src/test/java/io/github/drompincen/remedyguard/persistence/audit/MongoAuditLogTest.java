package io.github.drompincen.remedyguard.persistence.audit;

import io.github.drompincen.remedyguard.persistence.document.AuditEntryDocument;
import io.github.drompincen.remedyguard.persistence.repository.AuditEntryRepository;
import io.github.drompincen.remedyguard.protocol.api.AuditEntry;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.error.AuditWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoAuditLogTest {

    private static final Instant NOW = Instant.parse("2026-10-18T10:00:00Z");

    @Mock
    private AuditEntryRepository repository;

    private MongoAuditLog auditLog;

    @BeforeEach
    void setUp() {
        auditLog = new MongoAuditLog(repository);
    }

    @Test
    void firstAppendStartsFromGenesis() {
        when(repository.findTopByOrderBySeqDesc()).thenReturn(Optional.empty());
        when(repository.save(any(AuditEntryDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        AuditEntry entry = auditLog.append(decision("t1"));

        assertThat(entry.seq()).isEqualTo(1);
        assertThat(entry.prevHash()).isEqualTo(AuditChain.GENESIS_HASH);
        ArgumentCaptor<AuditEntryDocument> saved = ArgumentCaptor.forClass(AuditEntryDocument.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getThreatId()).isEqualTo("t1");
        assertThat(saved.getValue().getHash()).isEqualTo(entry.hash());
    }

    @Test
    void appendContinuesFromStoredTail() {
        AuditEntry tail = AuditChain.next(41, "f".repeat(64), decision("old"));
        when(repository.findTopByOrderBySeqDesc()).thenReturn(Optional.of(MongoAuditLog.toDocument(tail)));
        when(repository.save(any(AuditEntryDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        AuditEntry first = auditLog.append(decision("t1"));
        AuditEntry second = auditLog.append(decision("t2"));

        assertThat(first.seq()).isEqualTo(43);
        assertThat(first.prevHash()).isEqualTo(tail.hash());
        assertThat(second.prevHash()).isEqualTo(first.hash());
        verify(repository, times(1)).findTopByOrderBySeqDesc();
    }

    @Test
    void failedSaveBecomesAuditWriteErrorAndReloadsTail() {
        when(repository.findTopByOrderBySeqDesc()).thenReturn(Optional.empty());
        when(repository.save(any(AuditEntryDocument.class)))
                .thenThrow(new DuplicateKeyException("seq exists"))
                .thenAnswer(inv -> inv.getArgument(0));

        assertThatThrownBy(() -> auditLog.append(decision("t1")))
                .isInstanceOf(AuditWriteException.class)
                .hasMessageContaining("t1");

        auditLog.append(decision("t1"));
        verify(repository, times(2)).findTopByOrderBySeqDesc();
    }

    @Test
    void verifyChecksStoredChain() {
        AuditEntry first = AuditChain.next(0, AuditChain.GENESIS_HASH, decision("t1"));
        AuditEntry second = AuditChain.next(first.seq(), first.hash(), decision("t2"));
        AuditEntryDocument tampered = MongoAuditLog.toDocument(second);
        tampered.setApproved(false);
        when(repository.findAllByOrderBySeqAsc()).thenReturn(List.of(MongoAuditLog.toDocument(first), tampered));

        var report = auditLog.verify();

        assertThat(report.total()).isEqualTo(2);
        assertThat(report.firstBadSeq()).isEqualTo(2L);
    }

    private static DecisionRecord decision(String threatId) {
        return DecisionRecord.approved(threatId, "Quarantine the file.", false, null, NOW);
    }
}
