package com.acme.shellguard.audit;

import com.acme.shellguard.util.EnvVars;
import com.acme.shellguard.util.ShellGuardDefaults;
import com.acme.shellguard.util.ShellGuardEnvKeys;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for {@link JsonlAuditStore}.
 *
 * @param logPath        the JSONL audit log file
 * @param queueCapacity  appends that may wait for the writer thread
 * @param offerTimeoutMs how long an append waits for queue space before failing
 * @param fsyncOnAppend  force each line to the storage device before acknowledging it
 */
public record AuditStoreSettings(Path logPath, int queueCapacity, long offerTimeoutMs, boolean fsyncOnAppend) {

    public AuditStoreSettings {
        Objects.requireNonNull(logPath, "logPath");
    }

    public static AuditStoreSettings forPath(Path logPath) {
        return new AuditStoreSettings(
            logPath,
            ShellGuardDefaults.DEFAULT_AUDIT_QUEUE_CAPACITY,
            ShellGuardDefaults.DEFAULT_AUDIT_OFFER_TIMEOUT_MS,
            ShellGuardDefaults.DEFAULT_AUDIT_FSYNC
        );
    }

    public static AuditStoreSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), Path.of(System.getProperty("user.home", ".")));
    }

    public static AuditStoreSettings fromEnvironment(Map<String, String> env, Path homeDir) {
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(homeDir, "homeDir");
        String rawPath = EnvVars.getOrDefault(env, ShellGuardEnvKeys.SHELLGUARD_AUDIT_LOG_PATH, null);
        Path path = rawPath == null ? defaultLogPath(homeDir) : Path.of(rawPath);
        return new AuditStoreSettings(
            path,
            EnvVars.getIntClamped(env, ShellGuardEnvKeys.SHELLGUARD_AUDIT_QUEUE_CAPACITY,
                ShellGuardDefaults.DEFAULT_AUDIT_QUEUE_CAPACITY, 1, 1 << 20),
            EnvVars.getLongClamped(env, ShellGuardEnvKeys.SHELLGUARD_AUDIT_OFFER_TIMEOUT_MS,
                ShellGuardDefaults.DEFAULT_AUDIT_OFFER_TIMEOUT_MS, 0L, 600_000L),
            EnvVars.getBoolean(env, ShellGuardEnvKeys.SHELLGUARD_AUDIT_FSYNC, ShellGuardDefaults.DEFAULT_AUDIT_FSYNC)
        );
    }

    /** {@code ~/.shellguard/audit.log} */
    public static Path defaultLogPath(Path homeDir) {
        return homeDir.resolve(ShellGuardDefaults.APP_DIR_NAME).resolve(ShellGuardDefaults.AUDIT_LOG_FILE_NAME);
    }
}
