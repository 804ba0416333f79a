package io.github.drompincen.remedyguard.persistence.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.drompincen.remedyguard.protocol.api.AuditEntry;
import io.github.drompincen.remedyguard.protocol.api.AuditIssue;
import io.github.drompincen.remedyguard.protocol.api.AuditVerifyReport;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Hash chaining shared by every audit sink. Each entry hashes its sequence number, the
 * previous entry's hash and the canonical JSON of its decision, so editing, dropping or
 * reordering an entry breaks the chain at that point.
 */
public final class AuditChain {

    public static final String GENESIS_HASH = "0".repeat(64);

    static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .build();

    private AuditChain() {}

    public static String hash(long seq, String prevHash, DecisionRecord decision) {
        String material = seq + "|" + prevHash + "|" + canonicalJson(decision);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static AuditEntry next(long previousSeq, String previousHash, DecisionRecord decision) {
        long seq = previousSeq + 1;
        return new AuditEntry(seq, previousHash, hash(seq, previousHash, decision), decision);
    }

    public static String canonicalJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public static AuditEntry parse(String line) throws JsonProcessingException {
        return MAPPER.readValue(line, AuditEntry.class);
    }

    /**
     * Walks {@code entries} in order. {@code unreadable} carries issues the sink found
     * before it could even parse an entry; they count towards the bad total.
     */
    public static AuditVerifyReport verify(List<AuditEntry> entries, List<AuditIssue> unreadable) {
        List<AuditIssue> issues = new ArrayList<>(unreadable);
        String expectedPrev = GENESIS_HASH;
        long expectedSeq = 1;
        int ok = 0;

        for (AuditEntry entry : entries) {
            String problem = null;
            if (entry.seq() != expectedSeq) {
                problem = "expected seq " + expectedSeq + " but found " + entry.seq();
            } else if (!expectedPrev.equals(entry.prevHash())) {
                problem = "prev_hash does not match the preceding entry";
            } else if (entry.decision() == null
                    || !hash(entry.seq(), entry.prevHash(), entry.decision()).equals(entry.hash())) {
                problem = "hash mismatch";
            }
            if (problem == null) {
                ok++;
            } else {
                issues.add(new AuditIssue(entry.seq(), problem));
            }
            expectedPrev = entry.hash();
            expectedSeq = entry.seq() + 1;
        }

        issues.sort(Comparator.comparingLong(AuditIssue::seq));
        int total = entries.size() + unreadable.size();
        Long firstBad = issues.isEmpty() ? null : issues.get(0).seq();
        String latest = entries.isEmpty() ? GENESIS_HASH : entries.get(entries.size() - 1).hash();
        return new AuditVerifyReport(total, ok, total - ok, firstBad, latest, issues);
    }
}
