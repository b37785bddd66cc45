package com.acme.shellguard.util;

/**
 * Canonical environment variable names read by the policy and audit layers.
 */
public final class ShellGuardEnvKeys {
    public static final String SHELLGUARD_ALLOWED_COMMANDS = "SHELLGUARD_ALLOWED_COMMANDS";
    public static final String SHELLGUARD_BLOCKED_COMMANDS = "SHELLGUARD_BLOCKED_COMMANDS";
    public static final String SHELLGUARD_COMPLIANCE_MODE = "SHELLGUARD_COMPLIANCE_MODE";

    public static final String SHELLGUARD_AUDIT_LOG_PATH = "SHELLGUARD_AUDIT_LOG_PATH";
    public static final String SHELLGUARD_AUDIT_QUEUE_CAPACITY = "SHELLGUARD_AUDIT_QUEUE_CAPACITY";
    public static final String SHELLGUARD_AUDIT_OFFER_TIMEOUT_MS = "SHELLGUARD_AUDIT_OFFER_TIMEOUT_MS";
    public static final String SHELLGUARD_AUDIT_FSYNC = "SHELLGUARD_AUDIT_FSYNC";

    public static final String SHELLGUARD_ORGANIZATION = "SHELLGUARD_ORGANIZATION";
    public static final String SHELLGUARD_DEPARTMENT = "SHELLGUARD_DEPARTMENT";

    public static final String USER = "USER";
    public static final String USERNAME = "USERNAME";

    private ShellGuardEnvKeys() {
    }
}
