package com.acme.shellguard.audit;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Whole-operation failure of an {@link AuditStore}. Carries a {@link Reason} so callers can report the
 * specific cause; an append that fails with this exception was not recorded.
 */
public final class AuditStoreException extends IOException {
    private final Reason reason;
    private final Path path;

    public AuditStoreException(Reason reason, Path path, String message) {
        this(reason, path, message, null);
    }

    public AuditStoreException(Reason reason, Path path, String message, Throwable cause) {
        super(message + " [" + reason + ", path=" + path + "]", cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.path = path;
    }

    public Reason reason() {
        return reason;
    }

    public Path path() {
        return path;
    }

    /** Maps a low-level I/O failure onto a reason. */
    static AuditStoreException classify(IOException e, Path path, Reason fallback, String action) {
        if (e instanceof AuditStoreException already) {
            return already;
        }
        Reason reason = fallback;
        if (e instanceof AccessDeniedException) {
            reason = Reason.ACCESS_DENIED;
        } else if (e instanceof NoSuchFileException) {
            reason = Reason.STORE_NOT_FOUND;
        } else if (isOutOfSpace(e)) {
            reason = Reason.STORAGE_FULL;
        }
        return new AuditStoreException(reason, path, action + " failed: " + e.getMessage(), e);
    }

    private static boolean isOutOfSpace(IOException e) {
        String msg = e.getMessage();
        if (msg == null) {
            return false;
        }
        String low = msg.toLowerCase(Locale.ROOT);
        return low.contains("no space left") || low.contains("disk full") || low.contains("not enough space");
    }

    public enum Reason {
        STORE_NOT_FOUND,
        ACCESS_DENIED,
        STORAGE_FULL,
        WRITE_FAILED,
        READ_FAILED,
        SERIALIZATION_FAILED,
        SATURATED,
        CLOSED,
        INTERRUPTED
    }
}
