package io.github.drompincen.remedyguard.persistence.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.drompincen.remedyguard.protocol.api.AuditEntry;
import io.github.drompincen.remedyguard.protocol.api.AuditIssue;
import io.github.drompincen.remedyguard.protocol.api.AuditVerifyReport;
import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.error.AuditWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Audit log kept as one JSON document per line. Appends hold an in-process lock and an
 * OS file lock, go out in a single channel write and are forced to disk before returning.
 */
@Service
@ConditionalOnProperty(name = "remedyguard.audit.sink", havingValue = "file", matchIfMissing = true)
public class JsonLinesAuditLog implements AuditLog, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesAuditLog.class);

    private final Path path;
    private final FileChannel channel;
    private final ReentrantLock writeLock = new ReentrantLock();

    private long lastSeq;
    private String lastHash = AuditChain.GENESIS_HASH;
    private long knownSize;

    @Autowired
    public JsonLinesAuditLog(@Value("${remedyguard.audit.path:logs/audit.jsonl}") String path) {
        this(Path.of(path));
    }

    public JsonLinesAuditLog(Path path) {
        this.path = path.toAbsolutePath();
        try {
            Path parent = this.path.getParent();
            if (parent != null) Files.createDirectories(parent);
            this.channel = FileChannel.open(this.path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new AuditWriteException("Cannot open audit log " + this.path, e);
        }
        resumeChain();
        log.info("Audit log at {} (last seq={})", this.path, lastSeq);
    }

    @Override
    public AuditEntry append(DecisionRecord decision) {
        Objects.requireNonNull(decision, "decision");
        writeLock.lock();
        try (FileLock ignored = channel.lock()) {
            if (channel.size() != knownSize) {
                // another process appended since our last write
                resumeChain();
            }
            AuditEntry entry = AuditChain.next(lastSeq, lastHash, decision);
            ByteBuffer buffer = ByteBuffer.wrap(
                    (AuditChain.canonicalJson(entry) + "\n").getBytes(StandardCharsets.UTF_8));
            try {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            } catch (IOException e) {
                rollBackTornWrite(e);
                throw e;
            }
            knownSize = channel.size();
            lastSeq = entry.seq();
            lastHash = entry.hash();
            return entry;
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            log.error("Failed to append audit entry for threat {}: {}", decision.threatId(), e.getMessage(), e);
            throw new AuditWriteException("Failed to append audit entry for threat " + decision.threatId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<AuditEntry> entries() {
        List<AuditEntry> entries = new ArrayList<>();
        readLines((lineNo, line) -> {
            try {
                entries.add(AuditChain.parse(line));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable audit line {} in {}", lineNo, path);
            }
        });
        return entries;
    }

    @Override
    public AuditVerifyReport verify() {
        List<AuditEntry> entries = new ArrayList<>();
        List<AuditIssue> unreadable = new ArrayList<>();
        readLines((lineNo, line) -> {
            try {
                entries.add(AuditChain.parse(line));
            } catch (JsonProcessingException e) {
                long seqGuess = entries.isEmpty() ? 1 : entries.get(entries.size() - 1).seq() + 1;
                unreadable.add(new AuditIssue(seqGuess, "line " + lineNo + " is not a readable audit entry"));
            }
        });
        AuditVerifyReport report = AuditChain.verify(entries, unreadable);
        if (!report.intact()) {
            log.warn("Audit log {} failed verification: {} of {} entries bad", path, report.bad(), report.total());
        }
        return report;
    }

    @Override
    public String describe() {
        return "file:" + path;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private void resumeChain() {
        long seq = 0;
        String hash = AuditChain.GENESIS_HASH;
        try {
            dropTornTail();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot repair audit log " + path, e);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                try {
                    AuditEntry entry = AuditChain.parse(line);
                    seq = entry.seq();
                    hash = entry.hash();
                } catch (JsonProcessingException e) {
                    log.warn("Unreadable audit line in {} while resuming chain", path);
                }
            }
            knownSize = Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read audit log " + path, e);
        }
        lastSeq = seq;
        lastHash = hash;
    }

    // a crash mid-write can leave a last line without its newline; it was never acknowledged
    private void dropTornTail() throws IOException {
        long size = channel.size();
        if (size == 0) return;
        long keep = 0;
        try (SeekableByteChannel reader = Files.newByteChannel(path, StandardOpenOption.READ)) {
            ByteBuffer chunk = ByteBuffer.allocate(4096);
            long pos = size;
            boolean found = false;
            while (pos > 0 && !found) {
                int len = (int) Math.min(chunk.capacity(), pos);
                pos -= len;
                chunk.clear();
                chunk.limit(len);
                reader.position(pos);
                int read;
                do {
                    read = reader.read(chunk);
                } while (read >= 0 && chunk.hasRemaining());
                for (int i = len - 1; i >= 0; i--) {
                    if (chunk.get(i) == '\n') {
                        keep = pos + i + 1;
                        found = true;
                        break;
                    }
                }
            }
        }
        if (keep < size) {
            log.warn("Dropping {} bytes of incomplete trailing line from {}", size - keep, path);
            channel.truncate(keep);
            channel.force(true);
        }
    }

    private void rollBackTornWrite(IOException cause) {
        try {
            channel.truncate(knownSize);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private void readLines(LineConsumer consumer) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (!line.isBlank()) consumer.accept(lineNo, line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read audit log " + path, e);
        }
    }

    @FunctionalInterface
    private interface LineConsumer {
        void accept(int lineNo, String line);
    }
}
