package com.acme.shellguard.audit;

import com.acme.shellguard.policy.SafetyTier;

import java.time.Instant;
import java.util.Objects;

/**
 * One classification/execution outcome. {@code organization}, {@code department}, {@code exitCode},
 * {@code notes} and {@code sessionId} are optional and may be null.
 */
public record AuditRecord(
    Instant timestamp,
    String user,
    String organization,
    String department,
    String naturalLanguageInput,
    String generatedCommand,
    boolean executed,
    Integer exitCode,
    SafetyTier tier,
    String backendId,
    String notes,
    String sessionId
) {
    public AuditRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(naturalLanguageInput, "naturalLanguageInput");
        Objects.requireNonNull(generatedCommand, "generatedCommand");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(backendId, "backendId");
    }

    /** Executed and either reported a non-zero exit code or none at all. */
    public boolean failedExecution() {
        return executed && (exitCode == null || exitCode != 0);
    }
}
