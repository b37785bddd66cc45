package com.acme.shellguard.policy;

import java.util.Objects;

/**
 * Outcome of one policy evaluation. {@code reason} and {@code matchedRule} are null for safe commands.
 */
public record Verdict(
    SafetyTier tier,
    String reason,
    String matchedRule
) {
    private static final Verdict SAFE = new Verdict(SafetyTier.SAFE, null, null);

    public Verdict {
        Objects.requireNonNull(tier, "tier");
    }

    public static Verdict safe() {
        return SAFE;
    }

    public static Verdict blocked(String reason, String matchedRule) {
        return new Verdict(SafetyTier.BLOCKED, reason, matchedRule);
    }

    public boolean isBlocked() {
        return tier == SafetyTier.BLOCKED;
    }

    /** True for tiers the caller should confirm with the user before executing. */
    public boolean requiresConfirmation() {
        return tier == SafetyTier.WARNING || tier == SafetyTier.DANGEROUS;
    }
}
