package com.actionguard.gateway.audit;

import com.actionguard.gateway.workspace.WorkspaceProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only JSON-lines audit trail, one line per executed batch:
 * <pre>
 *   {"checksum":"&lt;sha256 hex&gt;","record":{...}}
 * </pre>
 * The checksum covers the exact compact serialization of {@code record}.
 * It only vouches for its own line: checksums are not chained, so dropped
 * or reordered lines are not detectable from the file alone.
 *
 * Lines are never rewritten. Each append is a single write on an
 * {@code APPEND} channel followed by {@code force}, so a crash leaves at
 * most a torn last line, which {@link #lastRecord()} treats as corrupt and
 * the next append steps over.
 */
@Component
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final Path         file;
    private final ObjectMapper json;

    public AuditLog(WorkspaceProperties properties, ObjectMapper objectMapper) {
        this.file = properties.auditLogPath();
        // own copy: compact output and ISO timestamps regardless of the app-wide settings
        this.json = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    // ------------------------------------------------------------------
    // Write
    // ------------------------------------------------------------------

    /**
     * Serialize, checksum and append {@code record} as one line.
     *
     * Synchronized: batches for different environments append concurrently,
     * and the torn-line check and the write must not interleave.
     *
     * @throws AuditLogException if the line cannot be written
     */
    public synchronized AuditEntry append(AuditRecord record) {
        String line;
        AuditEntry entry;
        try {
            String payload = json.writeValueAsString(record);
            entry = new AuditEntry(Checksums.sha256(payload), record);
            line = "{\"checksum\":" + json.writeValueAsString(entry.checksum())
                    + ",\"record\":" + payload + "}\n";
        } catch (JsonProcessingException e) {
            throw new AuditLogException("Audit record serialization failed", e);
        }

        try {
            Files.createDirectories(file.getParent());
            if (endsWithTornLine()) {
                line = "\n" + line;
            }
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new AuditLogException("Cannot append to audit log " + file, e);
        }
        log.info("Audit entry appended: env={} risk={} checksum={}",
                record.env() == null ? null : record.env().id(), record.risk(), entry.checksum());
        return entry;
    }

    // ------------------------------------------------------------------
    // Read
    // ------------------------------------------------------------------

    /**
     * The record on the final line, or empty if the log is missing, empty or
     * its last line cannot be parsed.
     */
    public Optional<AuditRecord> lastRecord() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            if (lines.isEmpty()) {
                return Optional.empty();
            }
            JsonNode entry = json.readTree(lines.get(lines.size() - 1));
            return Optional.of(json.treeToValue(entry.get("record"), AuditRecord.class));
        } catch (IOException | RuntimeException e) {
            log.warn("Last audit line in {} is unreadable: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Recompute every stored line's checksum over its stored record.
     *
     * @throws AuditLogException if the file exists but cannot be read
     */
    public List<LineVerification> verify() {
        List<LineVerification> checks = new ArrayList<>();
        if (!Files.exists(file)) {
            return checks;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AuditLogException("Cannot read audit log " + file, e);
        }
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).isBlank()) continue;
            checks.add(verifyLine(i + 1, lines.get(i)));
        }
        return checks;
    }

    /** Location of the log file. */
    public Path file() {
        return file;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private LineVerification verifyLine(int lineNumber, String line) {
        try {
            JsonNode node = json.readTree(line);
            if (!(node instanceof ObjectNode entry)
                    || !entry.hasNonNull("checksum") || !entry.hasNonNull("record")) {
                return new LineVerification(lineNumber, false, "missing checksum or record");
            }
            String expected = Checksums.sha256(json.writeValueAsString(entry.get("record")));
            return expected.equals(entry.get("checksum").asText())
                    ? new LineVerification(lineNumber, true, "ok")
                    : new LineVerification(lineNumber, false, "checksum mismatch");
        } catch (JsonProcessingException e) {
            return new LineVerification(lineNumber, false, "unparseable line");
        }
    }

    private boolean endsWithTornLine() throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return false;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(channel.size() - 1);
            channel.read(last);
            return last.get(0) != '\n';
        }
    }
}
