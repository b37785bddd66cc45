package com.acme.shellguard.policy;

/**
 * Classifies candidate shell commands into safety tiers.
 *
 * <p>Implementations must be stateless and thread-safe, perform no I/O and never throw: ambiguity
 * resolves to the most conservative verdict available.</p>
 */
public interface PolicyEngine {
    Verdict evaluate(String command, PolicyConfig config);
}
