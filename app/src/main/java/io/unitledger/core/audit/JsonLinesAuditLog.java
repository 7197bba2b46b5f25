package io.unitledger.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Audit log persisted as one JSON object per line ({@code audit.jsonl}).
 * Existing lines are loaded on open; a truncated trailing line is dropped with a warning.
 * An unreadable line anywhere else refuses to open.
 */
public final class JsonLinesAuditLog extends InMemoryAuditLog {
    private static final Logger LOG = Logger.getLogger(JsonLinesAuditLog.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;

    private JsonLinesAuditLog(Path file, List<AuditEntry> existing) {
        super(existing);
        this.file = file;
    }

    public static JsonLinesAuditLog open(Path file) {
        List<AuditEntry> existing = new ArrayList<>();
        boolean damaged = false;
        if (Files.exists(file)) {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                int lineNo = 0;
                int unreadableLine = 0;
                while ((line = reader.readLine()) != null) {
                    lineNo++;
                    if (line.isBlank()) {
                        continue;
                    }
                    if (unreadableLine > 0) {
                        throw new IllegalStateException("Audit log " + file + " has an unreadable line " + unreadableLine
                                + " followed by more entries at line " + lineNo);
                    }
                    try {
                        AuditEntry entry = MAPPER.readValue(line, AuditEntry.class);
                        if (entry.sequence() != existing.size()) {
                            throw new IllegalStateException("Audit log " + file + " has a gap at line " + lineNo
                                    + " (expected sequence " + existing.size() + ", found " + entry.sequence() + ")");
                        }
                        existing.add(entry);
                    } catch (JsonProcessingException e) {
                        unreadableLine = lineNo;
                        int bad = lineNo;
                        LOG.warning(() -> "Unreadable audit line " + bad + " in " + file + ": " + e.getOriginalMessage());
                    }
                }
                damaged = unreadableLine > 0;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read audit log " + file, e);
            }
        } else {
            try {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to create audit log directory for " + file, e);
            }
        }
        if (damaged) {
            LOG.warning(() -> "Dropping truncated tail of " + file);
            rewrite(file, existing);
        }
        int loaded = existing.size();
        LOG.info(() -> "Audit log " + file + " opened with " + loaded + " entries");
        return new JsonLinesAuditLog(file, existing);
    }

    // later appends must not land on the same line as the dropped fragment
    private static void rewrite(Path file, List<AuditEntry> entries) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (AuditEntry entry : entries) {
                writer.write(MAPPER.writeValueAsString(entry));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rewrite audit log " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    protected void persist(List<AuditEntry> appended) {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (AuditEntry entry : appended) {
                writer.write(MAPPER.writeValueAsString(entry));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to audit log " + file, e);
        }
    }
}
