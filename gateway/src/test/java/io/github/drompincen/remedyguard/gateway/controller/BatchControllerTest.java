package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.protocol.api.BatchReport;
import io.github.drompincen.remedyguard.protocol.api.BatchRequest;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.api.ThreatRecord;
import io.github.drompincen.remedyguard.runtime.batch.BatchOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchControllerTest {

    @Mock
    private BatchOrchestrator batchOrchestrator;

    private BatchController controller;

    @BeforeEach
    void setUp() {
        controller = new BatchController(batchOrchestrator);
    }

    @Test
    void batchDelegatesThreatsInOrder() {
        List<ThreatRecord> threats = List.of(ThreatRecord.of("t1", "a"), ThreatRecord.of("t2", "b"));
        BatchReport report = new BatchReport(List.of(
                DecisionRecord.approved("t1", "Monitor.", false, null, Instant.now()),
                DecisionRecord.failed("t2", "Generation failed: down", Instant.now())));
        when(batchOrchestrator.runBatch(threats)).thenReturn(report);

        BatchReport result = controller.batch(new BatchRequest(threats));

        assertThat(result.report()).extracting(DecisionRecord::threatId).containsExactly("t1", "t2");
    }

    @Test
    void missingThreatListRunsEmptyBatch() {
        when(batchOrchestrator.runBatch(List.of())).thenReturn(new BatchReport(List.of()));

        assertThat(controller.batch(new BatchRequest(null)).report()).isEmpty();
    }
}
