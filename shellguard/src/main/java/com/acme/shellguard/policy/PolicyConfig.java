package com.acme.shellguard.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * Allow/deny patterns and the compliance flag supplied by the caller for each evaluation.
 *
 * <p>Null or blank patterns are dropped and the rest trimmed: a blank pattern is a substring of every
 * command and would otherwise block (or allow) everything.</p>
 */
public record PolicyConfig(
    List<String> allowList,
    List<String> denyList,
    boolean complianceMode
) {
    private static final PolicyConfig PERMISSIVE = new PolicyConfig(List.of(), List.of(), false);

    public PolicyConfig {
        allowList = sanitize(allowList);
        denyList = sanitize(denyList);
    }

    /** No patterns, compliance off: only the built-in heuristics apply. */
    public static PolicyConfig permissive() {
        return PERMISSIVE;
    }

    private static List<String> sanitize(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            if (p != null && !p.isBlank()) {
                out.add(p.trim());
            }
        }
        return List.copyOf(out);
    }
}
