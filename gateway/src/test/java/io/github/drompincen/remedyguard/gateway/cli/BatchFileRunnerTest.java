package io.github.drompincen.remedyguard.gateway.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.remedyguard.protocol.api.BatchReport;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.runtime.batch.BatchOrchestrator;
import io.github.drompincen.remedyguard.runtime.ingest.ThreatCsvReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchFileRunnerTest {

    @TempDir
    Path tempDir;

    @Mock
    private BatchOrchestrator batchOrchestrator;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private BatchFileRunner runner;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        runner = new BatchFileRunner(new ThreatCsvReader(), batchOrchestrator, mapper,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsReportForCsvFile() throws Exception {
        Path csv = tempDir.resolve("threats.csv");
        Files.writeString(csv, "id,description\nmalware-001,Ransomware\npup-2,Toolbar\n");
        when(batchOrchestrator.runBatch(anyList())).thenAnswer(inv -> {
            List<?> threats = inv.getArgument(0);
            assertThat(threats).hasSize(2);
            return new BatchReport(List.of(
                    DecisionRecord.denied("malware-001", "Delete it.", "Destructive action denied: caller must confirm.",
                            Instant.parse("2026-10-18T09:30:00Z")),
                    DecisionRecord.approved("pup-2", "Monitor.", false, null, Instant.parse("2026-10-18T09:30:00Z"))));
        });

        runner.run(new DefaultApplicationArguments("--batch=" + csv));

        assertThat(runner.getExitCode()).isZero();
        String json = out.toString(StandardCharsets.UTF_8);
        assertThat(json).contains("\"report\"").contains("\"threat_id\" : \"malware-001\"")
                .contains("\"timestamp\" : \"2026-10-18T09:30:00Z\"");
    }

    @Test
    void missingFileExitsWithOne() {
        int code = runner.process(tempDir.resolve("absent.csv"));

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).startsWith("Error: cannot read");
        verifyNoInteractions(batchOrchestrator);
    }

    @Test
    void batchWithoutFileExitsWithOne() {
        runner.run(new DefaultApplicationArguments("--batch"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .contains("--batch <csv_file> required");
    }

    @Test
    void orchestratorFailureExitsWithOne() throws Exception {
        Path csv = tempDir.resolve("threats.csv");
        Files.writeString(csv, "id\nt1\n");
        when(batchOrchestrator.runBatch(anyList())).thenThrow(new IllegalStateException("pool closed"));

        assertThat(runner.process(csv)).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Batch failed: pool closed");
    }

    @Test
    void runIsNoOpWithoutBatchOption() {
        runner.run(new DefaultApplicationArguments("--server.port=8080"));

        assertThat(runner.getExitCode()).isZero();
        verifyNoInteractions(batchOrchestrator);
    }

    @Test
    void recognisesBatchInvocation() {
        assertThat(BatchFileRunner.isBatchInvocation(new String[]{"--batch=x.csv"})).isTrue();
        assertThat(BatchFileRunner.isBatchInvocation(new String[]{"--batch", "x.csv"})).isTrue();
        assertThat(BatchFileRunner.isBatchInvocation(new String[]{"--batchy"})).isFalse();
        assertThat(BatchFileRunner.isBatchInvocation(null)).isFalse();
    }
}
