package com.acme.shellguard.audit;

import com.acme.shellguard.util.ShellGuardDefaults;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the audit log file handle. A single daemon thread takes encoded lines off a bounded queue and
 * writes each one, newline included, before completing its future; this thread is the only code that
 * writes the file, so lines from concurrent callers never interleave.
 *
 * <p>There is at most one live writer per normalized log path in the process. Stores obtain it with
 * {@link #acquire} and hand it back with {@link #release}; the settings of the first holder apply. A
 * writer replacing a released one waits for its predecessor's thread to finish before writing.</p>
 *
 * <p>Every accepted submission is completed exactly once, also when the writer shuts down.</p>
 */
final class AuditLogWriter {
    private static final Logger LOG = Logger.getLogger(AuditLogWriter.class.getName());
    private static final byte NEWLINE = '\n';
    private static final ConcurrentHashMap<Path, AuditLogWriter> SHARED = new ConcurrentHashMap<>();

    private final Path logPath;
    private final BlockingQueue<PendingAppend> queue;
    private final long offerTimeoutMs;
    private final boolean fsyncOnAppend;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong appended = new AtomicLong();
    private final AtomicLong writeErrors = new AtomicLong();
    private final Thread writerThread;

    // guarded by this
    private int references;
    private boolean released;

    // writer thread only
    private AuditLogWriter predecessor;
    private FileChannel channel;

    private AuditLogWriter(Path logPath, int queueCapacity, long offerTimeoutMs, boolean fsyncOnAppend,
                           AuditLogWriter predecessor) {
        this.logPath = logPath;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.offerTimeoutMs = Math.max(0L, offerTimeoutMs);
        this.fsyncOnAppend = fsyncOnAppend;
        this.predecessor = predecessor;
        this.writerThread = new Thread(this::writerLoop, "audit-log-writer");
        this.writerThread.setDaemon(true);
        this.writerThread.start();
    }

    /** Returns the live writer for {@code logPath}, starting one if there is none. */
    static AuditLogWriter acquire(Path logPath, int queueCapacity, long offerTimeoutMs, boolean fsyncOnAppend) {
        Objects.requireNonNull(logPath, "logPath");
        Path key = logPath.toAbsolutePath().normalize();
        return SHARED.compute(key, (path, existing) -> {
            if (existing != null && existing.retain()) {
                return existing;
            }
            AuditLogWriter created = new AuditLogWriter(path, queueCapacity, offerTimeoutMs, fsyncOnAppend, existing);
            created.retain();
            return created;
        });
    }

    /** Drops one reference; the last one stops the writer after its queued lines are written. */
    void release() {
        synchronized (this) {
            if (released || --references > 0) {
                return;
            }
            released = true;
        }
        close();
        SHARED.remove(logPath, this);
    }

    private synchronized boolean retain() {
        if (released || !running.get()) {
            return false;
        }
        references++;
        return true;
    }

    /**
     * Queues one encoded line (without trailing newline). The returned future completes when the line
     * is on disk, or exceptionally with an {@link AuditStoreException}.
     */
    CompletableFuture<Void> submit(byte[] line) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(
                new AuditStoreException(AuditStoreException.Reason.CLOSED, logPath, "audit writer is closed"));
        }
        PendingAppend pending = new PendingAppend(line, new CompletableFuture<>());
        try {
            if (!queue.offer(pending, offerTimeoutMs, TimeUnit.MILLISECONDS)) {
                return CompletableFuture.failedFuture(new AuditStoreException(
                    AuditStoreException.Reason.SATURATED, logPath,
                    "audit writer queue full after " + offerTimeoutMs + "ms"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.failedFuture(new AuditStoreException(
                AuditStoreException.Reason.INTERRUPTED, logPath, "interrupted while queueing audit record", e));
        }
        // shutdown may have started between the running check and the offer
        if (!running.get()) {
            awaitWriterExit();
            if (!writerThread.isAlive()) {
                failRemaining();
            }
        }
        return pending.future();
    }

    long appendedCount() {
        return appended.get();
    }

    long writeErrorCount() {
        return writeErrors.get();
    }

    private void writerLoop() {
        awaitPredecessor();
        PendingAppend inFlight = null;
        try {
            while (running.get() || !queue.isEmpty()) {
                inFlight = queue.poll(ShellGuardDefaults.AUDIT_WRITER_POLL_MS, TimeUnit.MILLISECONDS);
                if (inFlight != null) {
                    write(inFlight);
                    inFlight = null;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Throwable t) {
            LOG.log(Level.SEVERE, "Audit writer stopped unexpectedly", t);
            running.set(false);
            if (inFlight != null) {
                inFlight.future().completeExceptionally(new AuditStoreException(
                    AuditStoreException.Reason.WRITE_FAILED, logPath, "audit writer stopped unexpectedly", t));
            }
        } finally {
            closeChannel();
            failRemaining();
        }
    }

    private void awaitPredecessor() {
        AuditLogWriter previous = predecessor;
        predecessor = null;
        if (previous == null) {
            return;
        }
        previous.awaitWriterExit();
        if (previous.writerThread.isAlive()) {
            LOG.warning(() -> "Previous audit writer for " + logPath + " is still running");
        }
    }

    private void write(PendingAppend pending) {
        try {
            FileChannel ch = ensureOpen();
            ByteBuffer buf = ByteBuffer.allocate(pending.line().length + 1);
            buf.put(pending.line()).put(NEWLINE).flip();
            writeFully(ch, buf);
            if (fsyncOnAppend) {
                ch.force(false);
            }
            appended.incrementAndGet();
            pending.future().complete(null);
        } catch (IOException e) {
            writeErrors.incrementAndGet();
            LOG.log(Level.WARNING, "Audit log write failed: " + logPath, e);
            // reopen on the next append so a torn tail gets terminated first
            closeChannel();
            pending.future().completeExceptionally(
                AuditStoreException.classify(e, logPath, AuditStoreException.Reason.WRITE_FAILED, "append"));
        }
    }

    private FileChannel ensureOpen() throws IOException {
        if (channel != null) {
            return channel;
        }
        Path parent = logPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel ch = FileChannel.open(logPath,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        try {
            terminateTornTail(ch);
        } catch (IOException e) {
            ch.close();
            throw e;
        }
        channel = ch;
        return ch;
    }

    /**
     * A crash or failed write can leave a final line without its newline. Appending straight after it
     * would glue the next record onto the fragment, so the fragment is closed off as its own line.
     */
    private void terminateTornTail(FileChannel ch) throws IOException {
        long size = ch.size();
        if (size == 0L) {
            return;
        }
        ByteBuffer last = ByteBuffer.allocate(1);
        try (FileChannel reader = FileChannel.open(logPath, StandardOpenOption.READ)) {
            reader.read(last, size - 1);
        }
        if (last.get(0) != NEWLINE) {
            LOG.warning(() -> "Audit log " + logPath + " ends with a partial line, terminating it");
            writeFully(ch, ByteBuffer.wrap(new byte[]{NEWLINE}));
        }
    }

    private static void writeFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            ch.write(buf);
        }
    }

    private void closeChannel() {
        FileChannel ch = channel;
        channel = null;
        if (ch == null) {
            return;
        }
        try {
            ch.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "Audit log close failed", e);
        }
    }

    private void failRemaining() {
        List<PendingAppend> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        for (PendingAppend p : leftovers) {
            p.future().completeExceptionally(new AuditStoreException(
                AuditStoreException.Reason.CLOSED, logPath, "audit writer closed before record was written"));
        }
    }

    private void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        awaitWriterExit();
        if (writerThread.isAlive()) {
            LOG.warning("Audit writer did not stop within " + ShellGuardDefaults.AUDIT_WRITER_SHUTDOWN_MS + "ms");
        } else {
            failRemaining();
        }
    }

    private void awaitWriterExit() {
        try {
            writerThread.join(ShellGuardDefaults.AUDIT_WRITER_SHUTDOWN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record PendingAppend(byte[] line, CompletableFuture<Void> future) {}
}
