package com.acme.shellguard.audit;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy result of {@link AuditStore#query(AuditQuery)}.
 *
 * <p>Nothing is read until iteration starts, and every {@link #iterator()} re-opens the log and reads
 * it from the start, so the sequence can be iterated any number of times without holding the log in
 * memory. Lines that cannot be decoded are skipped and counted per iteration. A read failure in the
 * middle of an iteration surfaces as {@link UncheckedIOException} wrapping an
 * {@link AuditStoreException}.</p>
 */
public final class AuditRecordSequence implements Iterable<AuditRecord> {
    private static final Logger LOG = Logger.getLogger(AuditRecordSequence.class.getName());

    private final Path logPath;
    private final AuditQuery query;
    private final AuditLineCodec codec;

    AuditRecordSequence(Path logPath, AuditQuery query, AuditLineCodec codec) {
        this.logPath = Objects.requireNonNull(logPath, "logPath");
        this.query = Objects.requireNonNull(query, "query");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public AuditQuery query() {
        return query;
    }

    /** Opens a new scan. Close it when abandoning iteration early; exhausting it closes it. */
    @Override
    public Cursor iterator() {
        return new Cursor();
    }

    /** Streams the matches; the stream must be closed to release the file handle. */
    public Stream<AuditRecord> stream() {
        Cursor cursor = iterator();
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(cursor::close);
    }

    public List<AuditRecord> toList() {
        List<AuditRecord> out = new ArrayList<>();
        scan(out::add);
        return out;
    }

    /** Feeds every match to {@code sink} and reports what the scan saw. */
    public ScanSummary scan(Consumer<? super AuditRecord> sink) {
        long matched = 0L;
        try (Cursor cursor = iterator()) {
            while (cursor.hasNext()) {
                sink.accept(cursor.next());
                matched++;
            }
            return new ScanSummary(matched, cursor.malformedLines());
        }
    }

    public record ScanSummary(long matched, long malformedLines) {}

    /**
     * One pass over the log. Not thread-safe.
     */
    public final class Cursor implements Iterator<AuditRecord>, AutoCloseable {
        private BufferedReader reader;
        private boolean opened;
        private boolean finished;
        private AuditRecord next;
        private long lineNumber;
        private long malformedLines;
        private List<AuditRecord> newestFirst;
        private int newestFirstIndex;

        private Cursor() {
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            if (query.order() == AuditQuery.Order.NEWEST_FIRST) {
                next = nextNewestFirst();
            } else {
                next = readNextMatch();
            }
            if (next == null) {
                finished = true;
                close();
                return false;
            }
            return true;
        }

        @Override
        public AuditRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            AuditRecord out = next;
            next = null;
            return out;
        }

        /** Lines skipped so far because they could not be decoded. */
        public long malformedLines() {
            return malformedLines;
        }

        @Override
        public void close() {
            BufferedReader r = reader;
            reader = null;
            if (r == null) {
                return;
            }
            try {
                r.close();
            } catch (IOException e) {
                LOG.log(Level.FINE, "Closing audit log reader failed", e);
            }
        }

        private AuditRecord nextNewestFirst() {
            if (newestFirst == null) {
                newestFirst = new ArrayList<>();
                AuditRecord r;
                while ((r = readNextMatch()) != null) {
                    newestFirst.add(r);
                }
                newestFirstIndex = newestFirst.size();
            }
            return newestFirstIndex > 0 ? newestFirst.get(--newestFirstIndex) : null;
        }

        private AuditRecord readNextMatch() {
            try {
                if (!opened) {
                    opened = true;
                    // the decoder replaces malformed UTF-8, e.g. a multi-byte character cut by a crash
                    reader = new BufferedReader(new InputStreamReader(Files.newInputStream(logPath), StandardCharsets.UTF_8));
                }
                if (reader == null) {
                    return null;
                }
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    AuditRecord record;
                    try {
                        record = codec.decode(line);
                    } catch (AuditLineFormatException e) {
                        malformedLines++;
                        long n = lineNumber;
                        LOG.fine(() -> "Skipping malformed audit line " + n + " in " + logPath + ": " + e.getMessage());
                        continue;
                    }
                    if (query.matches(record)) {
                        return record;
                    }
                }
                close();
                return null;
            } catch (IOException e) {
                close();
                throw new UncheckedIOException(
                    AuditStoreException.classify(e, logPath, AuditStoreException.Reason.READ_FAILED, "read"));
            }
        }
    }
}
