package com.acme.shellguard.policy;

import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Policy engine combining the caller's deny list, compliance-mode allow list and the built-in
 * {@link DangerHeuristics} table.
 *
 * <p>Matching is a case-insensitive substring test, so a deny pattern {@code format} also blocks
 * {@code git log --format=%h}.</p>
 */
public final class DefaultPolicyEngine implements PolicyEngine {
    public static final String RULE_ALLOW_LIST = "compliance:allow-list";
    public static final String RULE_ENGINE_FAILURE = "engine:failure";
    static final String REASON_NOT_ALLOWED = "not in allow-list";

    private static final Logger LOG = Logger.getLogger(DefaultPolicyEngine.class.getName());

    @Override
    public Verdict evaluate(String command, PolicyConfig config) {
        try {
            return decide(command == null ? "" : command, config == null ? PolicyConfig.permissive() : config);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Policy evaluation failed, blocking command", e);
            return Verdict.blocked("policy evaluation failed", RULE_ENGINE_FAILURE);
        }
    }

    private static Verdict decide(String command, PolicyConfig config) {
        if (command.isBlank()) {
            return Verdict.safe();
        }
        String lower = command.toLowerCase(Locale.ROOT);

        String denied = firstMatch(lower, config.denyList());
        if (denied != null) {
            return Verdict.blocked("matches blocked pattern '" + denied + "'", denied);
        }

        if (config.complianceMode() && !config.allowList().isEmpty()
            && firstMatch(lower, config.allowList()) == null) {
            return Verdict.blocked(REASON_NOT_ALLOWED, RULE_ALLOW_LIST);
        }

        DangerHeuristics.Heuristic heuristic = DangerHeuristics.strongestMatch(command);
        if (heuristic != null) {
            return new Verdict(heuristic.tier(), heuristic.reason(), heuristic.ruleName());
        }
        return Verdict.safe();
    }

    private static String firstMatch(String lowerCommand, List<String> patterns) {
        for (String pattern : patterns) {
            if (lowerCommand.contains(pattern.toLowerCase(Locale.ROOT))) {
                return pattern;
            }
        }
        return null;
    }
}
