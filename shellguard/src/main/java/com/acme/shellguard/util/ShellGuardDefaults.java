package com.acme.shellguard.util;

import java.util.List;

/**
 * Default policy and audit settings.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class ShellGuardDefaults {

    // ---- Policy ----
    public static final List<String> DEFAULT_BLOCKED_COMMANDS = List.of("rm -rf /", "format", "del /s /q C:\\");
    public static final boolean DEFAULT_COMPLIANCE_MODE = true;

    // ---- Audit log ----
    public static final String APP_DIR_NAME = ".shellguard";
    public static final String AUDIT_LOG_FILE_NAME = "audit.log";
    public static final int DEFAULT_AUDIT_QUEUE_CAPACITY = 1024;
    public static final long DEFAULT_AUDIT_OFFER_TIMEOUT_MS = 5_000L;
    public static final boolean DEFAULT_AUDIT_FSYNC = true;
    public static final long AUDIT_WRITER_POLL_MS = 100L;
    public static final long AUDIT_WRITER_SHUTDOWN_MS = 5_000L;

    // ---- Recorder ----
    public static final String UNKNOWN_USER = "unknown";

    private ShellGuardDefaults() {
    }
}
