package io.github.drompincen.remedyguard.gateway.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.remedyguard.protocol.api.BatchReport;
import io.github.drompincen.remedyguard.protocol.api.ThreatRecord;
import io.github.drompincen.remedyguard.protocol.error.InputException;
import io.github.drompincen.remedyguard.runtime.batch.BatchOrchestrator;
import io.github.drompincen.remedyguard.runtime.ingest.ThreatCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Offline batch mode: {@code --batch=threats.csv} reads the CSV, runs it through the
 * batch orchestrator and prints the report as JSON on stdout.
 *
 * Exit status is 0 on success and 1 when the file cannot be read or parsed or the
 * batch itself fails.
 */
@Component
public class BatchFileRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchFileRunner.class);

    static final String BATCH_OPTION = "batch";

    private final ThreatCsvReader csvReader;
    private final BatchOrchestrator batchOrchestrator;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode;

    @Autowired
    public BatchFileRunner(ThreatCsvReader csvReader, BatchOrchestrator batchOrchestrator, ObjectMapper objectMapper) {
        this(csvReader, batchOrchestrator, objectMapper, System.out, System.err);
    }

    public BatchFileRunner(ThreatCsvReader csvReader, BatchOrchestrator batchOrchestrator,
                           ObjectMapper objectMapper, PrintStream out, PrintStream err) {
        this.csvReader = csvReader;
        this.batchOrchestrator = batchOrchestrator;
        this.objectMapper = objectMapper;
        this.out = out;
        this.err = err;
    }

    public static boolean isBatchInvocation(String[] args) {
        return args != null && Arrays.stream(args)
                .anyMatch(a -> a.equals("--" + BATCH_OPTION) || a.startsWith("--" + BATCH_OPTION + "="));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(BATCH_OPTION)) {
            return;
        }
        String csvFile = resolveCsvFile(args);
        if (csvFile == null) {
            err.println("Error: --batch <csv_file> required when running as a script.");
            exitCode = 1;
            return;
        }
        exitCode = process(Path.of(csvFile));
    }

    public int process(Path csvFile) {
        List<ThreatRecord> threats;
        try {
            threats = csvReader.read(csvFile);
        } catch (IOException | InputException e) {
            log.error("Cannot read threats from {}: {}", csvFile, e.getMessage());
            err.println("Error: cannot read " + csvFile + ": " + e.getMessage());
            return 1;
        }
        log.info("Read {} threats from {}", threats.size(), csvFile);

        try {
            BatchReport report = batchOrchestrator.runBatch(threats);
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            return 0;
        } catch (JsonProcessingException e) {
            err.println("Batch failed: cannot render report: " + e.getOriginalMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Batch over {} failed: {}", csvFile, e.getMessage(), e);
            err.println("Batch failed: " + e.getMessage());
            return 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // accepts both --batch=file.csv and --batch file.csv
    private static String resolveCsvFile(ApplicationArguments args) {
        List<String> values = args.getOptionValues(BATCH_OPTION);
        if (values != null) {
            for (String v : values) {
                if (v != null && !v.isBlank()) return v;
            }
        }
        List<String> nonOption = args.getNonOptionArgs();
        return nonOption.isEmpty() ? null : nonOption.get(0);
    }
}
