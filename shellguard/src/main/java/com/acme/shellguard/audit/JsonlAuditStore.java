package com.acme.shellguard.audit;

import com.acme.shellguard.policy.SafetyTier;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * {@link AuditStore} over a single append-only JSONL file, one record per line.
 *
 * <p>Appends are serialized through the one {@link AuditLogWriter} the process keeps for the log path,
 * so several stores opened on the same file still share a single writer. The writer is obtained on the
 * first append; a store that only reads never starts one. Queries and statistics open their own read
 * handles and stream the file. Only one process may append to a given file.</p>
 */
public final class JsonlAuditStore implements AuditStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(JsonlAuditStore.class.getName());

    private final Path logPath;
    private final AuditLineCodec codec = new AuditLineCodec();
    private final AuditStoreSettings settings;
    private final Object writerLock = new Object();

    // guarded by writerLock
    private AuditLogWriter writer;
    private boolean closed;

    public JsonlAuditStore(AuditStoreSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.logPath = settings.logPath();
    }

    public static JsonlAuditStore open(Path logPath) {
        return new JsonlAuditStore(AuditStoreSettings.forPath(logPath));
    }

    public Path logPath() {
        return logPath;
    }

    @Override
    public void append(AuditRecord record) throws AuditStoreException {
        Objects.requireNonNull(record, "record");
        byte[] line;
        try {
            line = codec.encodeLine(record);
        } catch (AuditLineFormatException e) {
            throw new AuditStoreException(AuditStoreException.Reason.SERIALIZATION_FAILED, logPath, e.getMessage(), e);
        }
        CompletableFuture<Void> written = writer().submit(line);
        try {
            written.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // the writer may still complete this record
            throw new AuditStoreException(AuditStoreException.Reason.INTERRUPTED, logPath,
                "interrupted while waiting for audit append; record may still be written", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuditStoreException storeError) {
                throw storeError;
            }
            throw new AuditStoreException(AuditStoreException.Reason.WRITE_FAILED, logPath, "append failed", cause);
        }
    }

    @Override
    public AuditRecordSequence query(AuditQuery query) throws AuditStoreException {
        Objects.requireNonNull(query, "query");
        requireReadableLog();
        return new AuditRecordSequence(logPath, query, codec);
    }

    @Override
    public AuditStatistics statistics(AuditQuery query) throws AuditStoreException {
        AuditRecordSequence records = query(query.order() == AuditQuery.Order.INSERTION
            ? query
            : new AuditQuery(query.user(), query.tier(), query.since(), query.until(), AuditQuery.Order.INSERTION));

        long total = 0L;
        long executed = 0L;
        long failed = 0L;
        Map<SafetyTier, Long> perTier = new EnumMap<>(SafetyTier.class);
        long malformed;
        try (AuditRecordSequence.Cursor cursor = records.iterator()) {
            while (cursor.hasNext()) {
                AuditRecord r = cursor.next();
                total++;
                if (r.executed()) executed++;
                if (r.failedExecution()) failed++;
                perTier.merge(r.tier(), 1L, Long::sum);
            }
            malformed = cursor.malformedLines();
        } catch (UncheckedIOException e) {
            if (e.getCause() instanceof AuditStoreException storeError) {
                throw storeError;
            }
            throw AuditStoreException.classify(e.getCause(), logPath, AuditStoreException.Reason.READ_FAILED, "statistics");
        }
        if (malformed > 0) {
            long skipped = malformed;
            LOG.warning(() -> "Audit log " + logPath + " has " + skipped + " malformed line(s)");
        }
        return new AuditStatistics(total, executed, failed, perTier, malformed);
    }

    /** Lines written to this log by the process since its writer started. */
    public long appendedCount() {
        AuditLogWriter w = currentWriter();
        return w == null ? 0L : w.appendedCount();
    }

    public long writeErrorCount() {
        AuditLogWriter w = currentWriter();
        return w == null ? 0L : w.writeErrorCount();
    }

    AuditLogWriter currentWriter() {
        synchronized (writerLock) {
            return writer;
        }
    }

    private AuditLogWriter writer() throws AuditStoreException {
        synchronized (writerLock) {
            if (closed) {
                throw new AuditStoreException(AuditStoreException.Reason.CLOSED, logPath, "audit store is closed");
            }
            if (writer == null) {
                writer = AuditLogWriter.acquire(logPath, settings.queueCapacity(), settings.offerTimeoutMs(),
                    settings.fsyncOnAppend());
            }
            return writer;
        }
    }

    private void requireReadableLog() throws AuditStoreException {
        if (!Files.exists(logPath)) {
            throw new AuditStoreException(AuditStoreException.Reason.STORE_NOT_FOUND, logPath, "audit log does not exist");
        }
        if (!Files.isRegularFile(logPath)) {
            throw new AuditStoreException(AuditStoreException.Reason.READ_FAILED, logPath, "audit log is not a regular file");
        }
        if (!Files.isReadable(logPath)) {
            throw new AuditStoreException(AuditStoreException.Reason.ACCESS_DENIED, logPath, "audit log is not readable");
        }
    }

    /**
     * Releases this store's hold on the log writer; the last holder stops it after the queued appends are
     * written. Later appends on this store fail with {@code CLOSED}.
     */
    @Override
    public void close() {
        AuditLogWriter w;
        synchronized (writerLock) {
            if (closed) {
                return;
            }
            closed = true;
            w = writer;
            writer = null;
        }
        if (w != null) {
            w.release();
        }
    }
}
