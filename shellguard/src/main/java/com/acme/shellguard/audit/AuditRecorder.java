package com.acme.shellguard.audit;

import com.acme.shellguard.policy.Verdict;
import com.acme.shellguard.util.EnvVars;
import com.acme.shellguard.util.ShellGuardDefaults;
import com.acme.shellguard.util.ShellGuardEnvKeys;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds and appends {@link AuditRecord}s for one deployment: stamps the time, the current user and
 * the configured organization and department, and carries the verdict's tier and reason.
 */
public final class AuditRecorder {
    private final AuditStore store;
    private final String organization;
    private final String department;
    private final Clock clock;
    private final Supplier<String> currentUser;

    public AuditRecorder(AuditStore store,
                         String organization,
                         String department,
                         Clock clock,
                         Supplier<String> currentUser) {
        this.store = Objects.requireNonNull(store, "store");
        this.organization = organization;
        this.department = department;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.currentUser = Objects.requireNonNull(currentUser, "currentUser");
    }

    public static AuditRecorder fromEnvironment(AuditStore store) {
        Map<String, String> env = System.getenv();
        return new AuditRecorder(
            store,
            EnvVars.getOrDefault(env, ShellGuardEnvKeys.SHELLGUARD_ORGANIZATION, null),
            EnvVars.getOrDefault(env, ShellGuardEnvKeys.SHELLGUARD_DEPARTMENT, null),
            Clock.systemUTC(),
            () -> resolveUser(env)
        );
    }

    /**
     * Appends one outcome and returns the record as written.
     *
     * @param exitCode null when the command was not executed or did not report one
     */
    public AuditRecord record(String input,
                              String command,
                              Verdict verdict,
                              boolean executed,
                              Integer exitCode,
                              String backendId,
                              String sessionId) throws AuditStoreException {
        Objects.requireNonNull(verdict, "verdict");
        AuditRecord record = new AuditRecord(
            clock.instant(),
            currentUser.get(),
            organization,
            department,
            input == null ? "" : input,
            command == null ? "" : command,
            executed,
            exitCode,
            verdict.tier(),
            backendId,
            notes(verdict),
            sessionId
        );
        store.append(record);
        return record;
    }

    static String notes(Verdict verdict) {
        if (verdict.reason() == null) {
            return null;
        }
        if (verdict.matchedRule() == null) {
            return verdict.reason();
        }
        return verdict.reason() + " (rule: " + verdict.matchedRule() + ")";
    }

    /** {@code USER}, then {@code USERNAME}, else {@code unknown}. */
    static String resolveUser(Map<String, String> env) {
        String user = EnvVars.getOrDefault(env, ShellGuardEnvKeys.USER, null);
        if (user == null) {
            user = EnvVars.getOrDefault(env, ShellGuardEnvKeys.USERNAME, ShellGuardDefaults.UNKNOWN_USER);
        }
        return user;
    }
}
