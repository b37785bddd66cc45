package com.acme.shellguard.audit;

import com.acme.shellguard.policy.SafetyTier;

import java.time.Instant;
import java.util.Objects;

/**
 * Filter over the audit log. Null fields do not filter. The time window is {@code since <= ts < until}.
 */
public record AuditQuery(
    String user,
    SafetyTier tier,
    Instant since,
    Instant until,
    Order order
) {
    private static final AuditQuery ALL = new AuditQuery(null, null, null, null, Order.INSERTION);

    public AuditQuery {
        Objects.requireNonNull(order, "order");
    }

    public static AuditQuery all() {
        return ALL;
    }

    public AuditQuery withUser(String user) {
        return new AuditQuery(user, tier, since, until, order);
    }

    public AuditQuery withTier(SafetyTier tier) {
        return new AuditQuery(user, tier, since, until, order);
    }

    public AuditQuery between(Instant since, Instant until) {
        return new AuditQuery(user, tier, since, until, order);
    }

    public AuditQuery newestFirst() {
        return new AuditQuery(user, tier, since, until, Order.NEWEST_FIRST);
    }

    public boolean matches(AuditRecord record) {
        if (user != null && !user.equals(record.user())) {
            return false;
        }
        if (tier != null && tier != record.tier()) {
            return false;
        }
        Instant ts = record.timestamp();
        if (since != null && ts.isBefore(since)) {
            return false;
        }
        return until == null || ts.isBefore(until);
    }

    public enum Order {
        /** File order, streamed. */
        INSERTION,
        /** Reverse file order; buffers the matching records of one scan. */
        NEWEST_FIRST
    }
}
