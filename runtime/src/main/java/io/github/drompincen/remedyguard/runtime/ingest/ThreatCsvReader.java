package io.github.drompincen.remedyguard.runtime.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.github.drompincen.remedyguard.protocol.api.ThreatRecord;
import io.github.drompincen.remedyguard.protocol.error.InputException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads threats from a CSV file with a header row. The first column is the threat id
 * whatever its header says; {@code file_path}, {@code sha256} and {@code description}
 * map to their fields and any other non-empty column lands in {@code additional_info}.
 */
@Component
public class ThreatCsvReader {

    private final CsvMapper mapper;

    public ThreatCsvReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public List<ThreatRecord> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<ThreatRecord> read(Reader reader) throws IOException {
        List<ThreatRecord> threats = new ArrayList<>();
        try (MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNextValue()) {
                return threats;
            }
            String[] header = normalizeHeader(rows.nextValue());
            int rowNo = 1;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                rowNo++;
                if (isBlankRow(row)) continue;
                threats.add(toThreat(header, row, rowNo));
            }
        }
        return threats;
    }

    private ThreatRecord toThreat(String[] header, String[] row, int rowNo) {
        String threatId = cell(row, 0);
        if (threatId == null) {
            throw new InputException("CSV row " + rowNo + " has no threat id in its first column");
        }
        String filePath = null;
        String sha256 = null;
        String description = null;
        ObjectNode extra = JsonNodeFactory.instance.objectNode();

        for (int col = 1; col < row.length; col++) {
            String value = cell(row, col);
            if (value == null) continue;
            String name = col < header.length && !header[col].isEmpty() ? header[col] : "column_" + (col + 1);
            switch (name) {
                case "file_path" -> filePath = value;
                case "sha256" -> sha256 = value;
                case "description" -> description = value;
                default -> extra.put(name, value);
            }
        }
        return new ThreatRecord(threatId, filePath, sha256, description, extra.isEmpty() ? null : extra);
    }

    private static String[] normalizeHeader(String[] header) {
        String[] normalized = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            String h = header[i] == null ? "" : header[i].strip();
            // a UTF-8 BOM survives into the first header cell
            if (i == 0 && h.startsWith("\uFEFF")) h = h.substring(1);
            normalized[i] = h.toLowerCase(Locale.ROOT);
        }
        return normalized;
    }

    private static String cell(String[] row, int col) {
        if (col >= row.length || row[col] == null) return null;
        String value = row[col].strip();
        return value.isEmpty() ? null : value;
    }

    private static boolean isBlankRow(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }
}
