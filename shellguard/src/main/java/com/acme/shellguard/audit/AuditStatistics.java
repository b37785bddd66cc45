package com.acme.shellguard.audit;

import com.acme.shellguard.policy.SafetyTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record AuditStatistics(
    long total,
    long executed,
    long failedExecutions,
    Map<SafetyTier, Long> perTierCounts,
    long malformedLines
) {
    public AuditStatistics {
        EnumMap<SafetyTier, Long> counts = new EnumMap<>(SafetyTier.class);
        for (SafetyTier tier : SafetyTier.values()) {
            Long v = perTierCounts == null ? null : perTierCounts.get(tier);
            counts.put(tier, v == null ? 0L : v);
        }
        perTierCounts = Collections.unmodifiableMap(counts);
    }

    public long count(SafetyTier tier) {
        return perTierCounts.get(tier);
    }

    public long dangerousOrBlocked() {
        return count(SafetyTier.DANGEROUS) + count(SafetyTier.BLOCKED);
    }
}
