package com.acme.shellguard.policy;

import com.acme.shellguard.util.ShellGuardDefaults;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads a {@link PolicyConfig} from the JSON shape produced by configuration loaders:
 * {@code {"allowedCommands": [...], "blockedCommands": [...], "complianceMode": true}}.
 *
 * <p>Missing or mistyped fields are logged and replaced by defaults (no patterns, compliance on);
 * this never throws.</p>
 */
public final class PolicyConfigs {
    static final String FIELD_ALLOWED = "allowedCommands";
    static final String FIELD_BLOCKED = "blockedCommands";
    static final String FIELD_COMPLIANCE = "complianceMode";

    private static final Logger LOG = Logger.getLogger(PolicyConfigs.class.getName());

    private PolicyConfigs() {
    }

    public static PolicyConfig fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            LOG.warning("Policy config is not a JSON object, using permissive defaults");
            return PolicyConfig.permissive();
        }
        return new PolicyConfig(
            patterns(root, FIELD_ALLOWED),
            patterns(root, FIELD_BLOCKED),
            flag(root, FIELD_COMPLIANCE)
        );
    }

    private static List<String> patterns(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            LOG.warning("Ignoring policy field " + field + ": expected array, got " + node.getNodeType());
            return List.of();
        }
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isTextual()) {
                out.add(item.asText());
            } else {
                LOG.warning("Skipping non-string entry in " + field + ": " + item);
            }
        }
        return out;
    }

    private static boolean flag(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return ShellGuardDefaults.DEFAULT_COMPLIANCE_MODE;
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isTextual()) {
            return Boolean.parseBoolean(node.asText().trim());
        }
        LOG.warning("Ignoring policy field " + field + ": expected boolean, got " + node.getNodeType());
        return ShellGuardDefaults.DEFAULT_COMPLIANCE_MODE;
    }
}
