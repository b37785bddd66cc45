package com.acme.shellguard.policy;

import java.util.Locale;

/**
 * Risk classification of a shell command. Declaration order is severity order.
 *
 * <p>The same enum is written to the audit log, so classification and logging cannot drift apart.</p>
 */
public enum SafetyTier {
    SAFE,
    WARNING,
    DANGEROUS,
    BLOCKED;

    /** Lowercase name used in the audit log {@code safety_level} field. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isMoreSevereThan(SafetyTier other) {
        return compareTo(other) > 0;
    }

    /**
     * Parses a wire name case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no tier
     */
    public static SafetyTier fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("safety level is blank");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "safe" -> SAFE;
            case "warning" -> WARNING;
            case "dangerous" -> DANGEROUS;
            case "blocked" -> BLOCKED;
            default -> throw new IllegalArgumentException("unknown safety level: " + raw);
        };
    }
}
