package io.github.drompincen.remedyguard.runtime.batch;

import io.github.drompincen.remedyguard.protocol.api.BatchReport;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.api.ThreatRecord;
import io.github.drompincen.remedyguard.protocol.error.AuditWriteException;
import io.github.drompincen.remedyguard.protocol.error.DecisionException;
import io.github.drompincen.remedyguard.runtime.gate.ApprovalGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives the approval gate over a list of threats. Batch submissions never carry
 * confirmation, so every destructive recommendation in a batch is denied. Items run in
 * parallel on the batch executor; the report keeps input order and always has one
 * record per input, each of which is also in the audit log when the log is writable.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final ApprovalGate gate;
    private final ExecutorService batchExecutor;
    private final Clock clock;

    public BatchOrchestrator(ApprovalGate gate,
                             @Qualifier("batchExecutor") ExecutorService batchExecutor,
                             Clock clock) {
        this.gate = gate;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
    }

    public BatchReport runBatch(List<ThreatRecord> threats) {
        if (threats == null || threats.isEmpty()) {
            return new BatchReport(List.of());
        }
        log.info("Starting batch of {} threats", threats.size());

        List<CompletableFuture<DecisionRecord>> pending = new ArrayList<>(threats.size());
        for (int i = 0; i < threats.size(); i++) {
            int index = i;
            ThreatRecord threat = threats.get(i);
            CompletableFuture<DecisionRecord> future;
            try {
                future = CompletableFuture.supplyAsync(() -> decideIsolated(index, threat), batchExecutor);
            } catch (RejectedExecutionException e) {
                log.warn("Batch executor rejected item {}, running it inline", index);
                future = CompletableFuture.completedFuture(decideIsolated(index, threat));
            }
            pending.add(future);
        }

        List<DecisionRecord> report = new ArrayList<>(threats.size());
        for (int i = 0; i < pending.size(); i++) {
            report.add(await(i, threats.get(i), pending.get(i)));
        }

        long approved = report.stream().filter(DecisionRecord::approved).count();
        log.info("Batch finished: {} threats, {} approved, {} not approved",
                report.size(), approved, report.size() - approved);
        return new BatchReport(report);
    }

    private DecisionRecord decideIsolated(int index, ThreatRecord threat) {
        String threatId = threat != null ? threat.threatId() : null;
        try {
            return gate.decide(threat, false);
        } catch (AuditWriteException e) {
            log.error("Batch threat {} (item {}) could not be logged: {}", threatId, index, e.getMessage());
            return unlogged(threatId, "Failed (" + e.kind() + "): " + e.getMessage());
        } catch (DecisionException e) {
            log.warn("Batch threat {} (item {}) failed: {}", threatId, index, e.getMessage());
            return e.decision().orElseGet(() -> placeholder(threatId, "Failed (" + e.kind() + "): " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error on batch threat {} (item {}): {}", threatId, index, e.getMessage(), e);
            return placeholder(threatId, "Unexpected error: " + e.getMessage());
        }
    }

    private DecisionRecord await(int index, ThreatRecord threat, CompletableFuture<DecisionRecord> future) {
        String threatId = threat != null ? threat.threatId() : null;
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Batch item {} ({}) did not complete: {}", index, threatId, cause.getMessage(), cause);
            return placeholder(threatId, "Unexpected error: " + cause.getMessage());
        }
    }

    // every report row gets an audit entry, unless the log itself is what failed
    private DecisionRecord placeholder(String threatId, String notes) {
        try {
            return gate.recordRejected(threatId, notes);
        } catch (RuntimeException e) {
            log.error("Could not log batch placeholder for threat {}: {}", threatId, e.getMessage());
            return unlogged(threatId, notes);
        }
    }

    private DecisionRecord unlogged(String threatId, String notes) {
        return DecisionRecord.failed(threatId, notes, Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));
    }
}
