package com.acme.shellguard.audit;

import com.acme.shellguard.policy.SafetyTier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.acme.shellguard.audit.AuditTestRecords.T0;
import static com.acme.shellguard.audit.AuditTestRecords.minimal;
import static com.acme.shellguard.audit.AuditTestRecords.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlAuditStoreTest {

    @TempDir
    Path dir;

    @Test
    void shouldReturnAppendedRecordWithAllFields() throws Exception {
        Path log = dir.resolve("nested/audit.log");
        AuditRecord written = new AuditRecord(
            Instant.parse("2024-03-01T10:15:30.123456789Z"), "alice", "Acme Corp", "Platform",
            "list files", "ls -la", true, 0, SafetyTier.SAFE, "ollama", "all good", "session-123");

        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            store.append(written);

            List<AuditRecord> all = store.query(AuditQuery.all()).toList();
            assertEquals(List.of(written), all);
            assertEquals(1L, store.appendedCount());
        }
    }

    @Test
    void shouldAggregateExecutedAndFailedCounts() throws Exception {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            store.append(record(T0, "alice", "ls", true, 0, SafetyTier.SAFE));
            store.append(record(T0.plusSeconds(1), "alice", "git status", true, 0, SafetyTier.SAFE));
            store.append(record(T0.plusSeconds(2), "bob", "rm -rf /", false, null, SafetyTier.BLOCKED));

            AuditStatistics stats = store.statistics();

            assertEquals(3L, stats.total());
            assertEquals(2L, stats.executed());
            assertEquals(0L, stats.failedExecutions());
            assertEquals(2L, stats.count(SafetyTier.SAFE));
            assertEquals(1L, stats.count(SafetyTier.BLOCKED));
            assertEquals(0L, stats.count(SafetyTier.WARNING));
            assertEquals(1L, stats.dangerousOrBlocked());
            assertEquals(0L, stats.malformedLines());
        }
    }

    @Test
    void shouldCountNonZeroAndMissingExitCodesAsFailures() throws Exception {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            store.append(record(T0, "alice", "make", true, 2, SafetyTier.SAFE));
            store.append(record(T0, "alice", "sleep 100", true, null, SafetyTier.SAFE));
            store.append(record(T0, "alice", "true", true, 0, SafetyTier.SAFE));
            store.append(record(T0, "alice", "false", false, 1, SafetyTier.SAFE));

            assertEquals(2L, store.statistics().failedExecutions());
        }
    }

    @Test
    void shouldFilterByUserTierAndHalfOpenWindow() throws Exception {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            store.append(minimal(T0, "alice", SafetyTier.SAFE));
            store.append(minimal(T0.plusSeconds(10), "bob", SafetyTier.WARNING));
            store.append(minimal(T0.plusSeconds(20), "alice", SafetyTier.DANGEROUS));
            store.append(minimal(T0.plusSeconds(30), "alice", SafetyTier.WARNING));

            assertEquals(List.of(T0, T0.plusSeconds(20), T0.plusSeconds(30)),
                timestamps(store.query(AuditQuery.all().withUser("alice"))));
            assertEquals(List.of(T0.plusSeconds(10), T0.plusSeconds(30)),
                timestamps(store.query(AuditQuery.all().withTier(SafetyTier.WARNING))));
            assertEquals(List.of(T0.plusSeconds(10), T0.plusSeconds(20)),
                timestamps(store.query(AuditQuery.all().between(T0.plusSeconds(10), T0.plusSeconds(30)))));
            assertEquals(List.of(T0.plusSeconds(30)),
                timestamps(store.query(AuditQuery.all().withUser("alice").withTier(SafetyTier.WARNING))));
            assertTrue(store.query(AuditQuery.all().withUser("ALICE")).toList().isEmpty());

            AuditStatistics aliceStats = store.statistics(AuditQuery.all().withUser("alice"));
            assertEquals(3L, aliceStats.total());
        }
    }

    @Test
    void shouldReturnNewestFirstOnRequest() throws Exception {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            for (int i = 0; i < 5; i++) {
                store.append(minimal(T0.plusSeconds(i), "alice", SafetyTier.SAFE));
            }

            List<Instant> newest = timestamps(store.query(AuditQuery.all().newestFirst()));

            assertEquals(List.of(T0.plusSeconds(4), T0.plusSeconds(3), T0.plusSeconds(2), T0.plusSeconds(1), T0), newest);
            assertEquals(5L, store.statistics(AuditQuery.all().newestFirst()).total());
        }
    }

    @Test
    void shouldYieldIdenticalResultsOnRepeatedIteration() throws Exception {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            for (int i = 0; i < 10; i++) {
                store.append(minimal(T0.plusSeconds(i), i % 2 == 0 ? "alice" : "bob", SafetyTier.SAFE));
            }
            AuditRecordSequence sequence = store.query(AuditQuery.all().withUser("bob"));

            List<AuditRecord> first = new ArrayList<>();
            sequence.forEach(first::add);
            List<AuditRecord> second = new ArrayList<>();
            sequence.forEach(second::add);

            assertEquals(5, first.size());
            assertEquals(first, second);
            assertEquals(first, sequence.toList());
        }
    }

    @Test
    void shouldMatchStatisticsTotalWithQueryLength() throws Exception {
        Path log = dir.resolve("audit.log");
        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            store.append(minimal(T0, "alice", SafetyTier.SAFE));
            store.append(minimal(T0, "bob", SafetyTier.BLOCKED));
        }
        Files.writeString(log, "garbage line\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            store.append(minimal(T0, "carol", SafetyTier.WARNING));

            AuditStatistics stats = store.statistics();
            AuditRecordSequence.ScanSummary summary = store.query(AuditQuery.all()).scan(r -> { });

            assertEquals(3L, stats.total());
            assertEquals(stats.total(), summary.matched());
            assertEquals(1L, stats.malformedLines());
            assertEquals(1L, summary.malformedLines());
        }
    }

    @Test
    void shouldCountGluedRecordsAsOneMalformedLine() throws Exception {
        Path log = dir.resolve("audit.log");
        AuditLineCodec codec = new AuditLineCodec();
        Files.writeString(log,
            codec.encode(minimal(T0, "alice", SafetyTier.SAFE)) + codec.encode(minimal(T0, "bob", SafetyTier.SAFE)) + "\n",
            StandardCharsets.UTF_8);

        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            AuditStatistics stats = store.statistics();

            assertEquals(0L, stats.total());
            assertEquals(1L, stats.malformedLines());
        }
    }

    @Test
    void shouldRoundTripTextWithUnpairedSurrogate() throws Exception {
        AuditRecord written = new AuditRecord(T0, "alice", null, null, "bad \uD800 input", "ls",
            false, null, SafetyTier.SAFE, "ollama", null, null);

        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            store.append(written);

            assertEquals(List.of(written), store.query(AuditQuery.all()).toList());
        }
    }

    @Test
    void shouldShareOneWriterBetweenStoresOnTheSameFile() throws Exception {
        Path log = dir.resolve("audit.log");
        Files.createDirectories(dir.resolve("sub"));
        JsonlAuditStore first = JsonlAuditStore.open(log);
        JsonlAuditStore second = JsonlAuditStore.open(dir.resolve("sub/../audit.log"));
        try {
            first.append(minimal(T0, "alice", SafetyTier.SAFE));
            second.append(minimal(T0.plusSeconds(1), "bob", SafetyTier.SAFE));

            assertSame(first.currentWriter(), second.currentWriter());
            assertEquals(2L, first.appendedCount());

            first.close();
            second.append(minimal(T0.plusSeconds(2), "carol", SafetyTier.SAFE));
            assertEquals(3, second.query(AuditQuery.all()).toList().size());
        } finally {
            first.close();
            second.close();
        }
    }

    @Test
    void shouldNotStartWriterForReadOnlyUse() throws Exception {
        Path log = dir.resolve("audit.log");
        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            store.append(minimal(T0, "alice", SafetyTier.SAFE));
        }

        try (JsonlAuditStore reader = JsonlAuditStore.open(log)) {
            assertEquals(1L, reader.statistics().total());
            assertNull(reader.currentWriter());
        }
    }

    @Test
    void shouldSkipTruncatedFinalLine() throws Exception {
        Path log = dir.resolve("audit.log");
        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            store.append(record(T0, "alice", "ls", true, 0, SafetyTier.SAFE));
            store.append(record(T0.plusSeconds(1), "bob", "rm -rf /", false, null, SafetyTier.BLOCKED));
        }
        Files.writeString(log, "{\"timestamp\":\"2024-03-01T10:00:05Z\",\"user\":\"ca", StandardCharsets.UTF_8,
            StandardOpenOption.APPEND);

        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            AuditStatistics stats = store.statistics();
            assertEquals(2L, stats.total());
            assertEquals(1L, stats.executed());
            assertEquals(1L, stats.count(SafetyTier.BLOCKED));
            assertTrue(stats.malformedLines() > 0);

            try (AuditRecordSequence.Cursor cursor = store.query(AuditQuery.all()).iterator()) {
                int n = 0;
                while (cursor.hasNext()) {
                    cursor.next();
                    n++;
                }
                assertEquals(2, n);
                assertEquals(1L, cursor.malformedLines());
            }
        }
    }

    @Test
    void shouldTerminateTornTailBeforeNextAppend() throws Exception {
        Path log = dir.resolve("audit.log");
        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            store.append(minimal(T0, "alice", SafetyTier.SAFE));
        }
        Files.writeString(log, "{\"timestamp\":\"2024", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        try (JsonlAuditStore store = JsonlAuditStore.open(log)) {
            AuditRecord next = minimal(T0.plusSeconds(5), "bob", SafetyTier.WARNING);
            store.append(next);

            List<AuditRecord> all = store.query(AuditQuery.all()).toList();
            assertEquals(2, all.size());
            assertEquals(next, all.get(1));
            assertEquals(1L, store.statistics().malformedLines());
        }
        List<String> lines = Files.readAllLines(log, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("{\"timestamp\":\"2024", lines.get(1));
    }

    @Test
    void shouldStreamLazilyAndReleaseOnClose() throws Exception {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            for (int i = 0; i < 50; i++) {
                store.append(minimal(T0.plusSeconds(i), "alice", SafetyTier.SAFE));
            }
            try (Stream<AuditRecord> stream = store.query(AuditQuery.all()).stream()) {
                List<Instant> firstThree = stream.limit(3).map(AuditRecord::timestamp).collect(Collectors.toList());
                assertEquals(List.of(T0, T0.plusSeconds(1), T0.plusSeconds(2)), firstThree);
            }
        }
    }

    @Test
    void shouldSeeRecordsAppendedBeforeIterationStarts() throws Exception {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"))) {
            store.append(minimal(T0, "alice", SafetyTier.SAFE));
            AuditRecordSequence sequence = store.query(AuditQuery.all());
            store.append(minimal(T0.plusSeconds(1), "alice", SafetyTier.SAFE));

            assertEquals(2, sequence.toList().size());
        }
    }

    @Test
    void shouldFailQueryWhenLogIsMissing() {
        try (JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("missing.log"))) {
            AuditStoreException e = assertThrows(AuditStoreException.class, () -> store.query(AuditQuery.all()));
            assertEquals(AuditStoreException.Reason.STORE_NOT_FOUND, e.reason());
            AuditStoreException stats = assertThrows(AuditStoreException.class, store::statistics);
            assertEquals(AuditStoreException.Reason.STORE_NOT_FOUND, stats.reason());
        }
    }

    @Test
    void shouldReportAppendToUncreatablePath() throws Exception {
        Path blocker = dir.resolve("not-a-dir");
        Files.writeString(blocker, "x", StandardCharsets.UTF_8);

        try (JsonlAuditStore store = JsonlAuditStore.open(blocker.resolve("audit.log"))) {
            AuditStoreException e = assertThrows(AuditStoreException.class,
                () -> store.append(minimal(T0, "alice", SafetyTier.SAFE)));
            assertTrue(e.getMessage().contains("append"));
            assertEquals(1L, store.writeErrorCount());
            assertEquals(0L, store.appendedCount());
        }
    }

    @Test
    void shouldRejectAppendsAfterClose() {
        JsonlAuditStore store = JsonlAuditStore.open(dir.resolve("audit.log"));
        store.close();

        AuditStoreException e = assertThrows(AuditStoreException.class,
            () -> store.append(minimal(T0, "alice", SafetyTier.SAFE)));
        assertEquals(AuditStoreException.Reason.CLOSED, e.reason());
        assertFalse(Files.exists(dir.resolve("audit.log")));
    }

    private static List<Instant> timestamps(Iterable<AuditRecord> records) {
        List<Instant> out = new ArrayList<>();
        Iterator<AuditRecord> it = records.iterator();
        while (it.hasNext()) {
            out.add(it.next().timestamp());
        }
        return out;
    }
}
