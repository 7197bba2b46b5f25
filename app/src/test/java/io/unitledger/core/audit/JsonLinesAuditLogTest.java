package io.unitledger.core.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesAuditLogTest {

    @TempDir
    Path tempDir;

    @Test
    void entriesSurviveReopen() {
        Path file = tempDir.resolve("audit.jsonl");
        JsonLinesAuditLog log = JsonLinesAuditLog.open(file);
        log.append(List.of(
                new LedgerEvent.Sponsored("sponsor-1", "user-b", "asset:a", 100L, 99L),
                new LedgerEvent.SponsoredReceived("sponsor-1", "user-b", "asset:a", 100L, 99L)));
        log.append(List.of(new LedgerEvent.SponsorClearedWithForfeit("user-b", 1, 99L, true)));

        JsonLinesAuditLog reopened = JsonLinesAuditLog.open(file);

        assertEquals(3L, reopened.nextSequence());
        List<AuditEntry> entries = reopened.entriesSince(0L);
        assertEquals(new LedgerEvent.Sponsored("sponsor-1", "user-b", "asset:a", 100L, 99L), entries.get(0).event());
        assertEquals(new LedgerEvent.SponsorClearedWithForfeit("user-b", 1, 99L, true), entries.get(2).event());
        assertEquals(2L, entries.get(2).sequence());
    }

    @Test
    void writesTypeTagPerLine() throws Exception {
        Path file = tempDir.resolve("audit.jsonl");
        JsonLinesAuditLog log = JsonLinesAuditLog.open(file);
        log.append(List.of(new LedgerEvent.EngineConfigured(null, "engine-1")));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"type\":\"engine_configured\""), lines.get(0));
    }

    @Test
    void truncatedTailIsDropped() throws Exception {
        Path file = tempDir.resolve("audit.jsonl");
        JsonLinesAuditLog log = JsonLinesAuditLog.open(file);
        log.append(List.of(new LedgerEvent.Forfeited("user-b", "asset:a", 5L)));
        Files.writeString(file, "{\"sequence\":1,\"timestampMillis\":1,\"ev", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        JsonLinesAuditLog reopened = JsonLinesAuditLog.open(file);
        assertEquals(1L, reopened.nextSequence());

        reopened.append(List.of(new LedgerEvent.Forfeited("user-b", "asset:c", 6L)));
        assertEquals(2L, JsonLinesAuditLog.open(file).nextSequence());
    }

    @Test
    void corruptMiddleLineFailsOpenAndKeepsFile() throws Exception {
        Path file = tempDir.resolve("audit.jsonl");
        JsonLinesAuditLog log = JsonLinesAuditLog.open(file);
        for (int i = 0; i < 5; i++) {
            log.append(List.of(new LedgerEvent.Forfeited("user-b", "asset:" + i, i + 1L)));
        }
        List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
        lines.set(1, lines.get(1).substring(0, 10));
        Files.write(file, lines, StandardCharsets.UTF_8);

        assertThrows(IllegalStateException.class, () -> JsonLinesAuditLog.open(file));
        assertEquals(lines, Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void sequenceGapFailsOpen() throws Exception {
        Path file = tempDir.resolve("audit.jsonl");
        JsonLinesAuditLog log = JsonLinesAuditLog.open(file);
        log.append(List.of(new LedgerEvent.Forfeited("user-b", "asset:a", 5L)));
        String first = Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
        Files.writeString(file, first.replace("\"sequence\":0", "\"sequence\":4") + System.lineSeparator(),
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        assertThrows(IllegalStateException.class, () -> JsonLinesAuditLog.open(file));
    }

    @Test
    void listenersSeeAppendsInOrder() {
        InMemoryAuditLog log = new InMemoryAuditLog();
        List<Long> seen = new CopyOnWriteArrayList<>();
        log.subscribe(entry -> seen.add(entry.sequence()));
        log.subscribe(entry -> {
            throw new IllegalStateException("listener failure must not break appends");
        });

        log.append(List.of(new LedgerEvent.Forfeited("user-b", "asset:a", 1L), new LedgerEvent.Forfeited("user-b", "asset:c", 2L)));
        log.append(List.of(new LedgerEvent.SponsorCleared("user-b", "sponsor-1")));

        assertEquals(List.of(0L, 1L, 2L), seen);
        assertEquals(1, log.entriesSince(2L).size());
        assertTrue(log.entriesSince(10L).isEmpty());
    }
}
