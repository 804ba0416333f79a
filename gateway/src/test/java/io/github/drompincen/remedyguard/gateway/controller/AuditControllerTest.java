package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.persistence.audit.JsonLinesAuditLog;
import io.github.drompincen.remedyguard.protocol.api.AuditEntry;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditControllerTest {

    @TempDir
    Path tempDir;

    private JsonLinesAuditLog auditLog;
    private AuditController controller;

    @BeforeEach
    void setUp() {
        auditLog = new JsonLinesAuditLog(tempDir.resolve("audit.jsonl"));
        controller = new AuditController(auditLog);
        for (int i = 1; i <= 5; i++) {
            auditLog.append(DecisionRecord.approved("t" + i, "Monitor.", false, null, Instant.now()));
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        auditLog.close();
    }

    @Test
    void latestReturnsNewestEntriesInOrder() {
        List<AuditEntry> latest = controller.latest(2);

        assertThat(latest).extracting(AuditEntry::seq).containsExactly(4L, 5L);
        assertThat(controller.latest(100)).hasSize(5);
    }

    @Test
    void verifyReportsIntactChain() {
        var report = controller.verify();

        assertThat(report.intact()).isTrue();
        assertThat(report.total()).isEqualTo(5);
    }
}
