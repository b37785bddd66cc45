package com.acme.shellguard.cli;

import com.acme.shellguard.policy.DefaultPolicyEngine;
import com.acme.shellguard.policy.EnvPolicyConfigProvider;
import com.acme.shellguard.policy.PolicyConfig;
import com.acme.shellguard.policy.PolicyConfigs;
import com.acme.shellguard.policy.Verdict;
import com.acme.shellguard.util.JsonCodec;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * Classifies one command and prints the verdict as JSON.
 *
 * <pre>PolicyCheckMain [--config policy.json] &lt;command...&gt;</pre>
 *
 * Exit status: 0 safe or warning, 1 dangerous, 2 blocked.
 */
public final class PolicyCheckMain {
    static final int EXIT_OK = 0;
    static final int EXIT_DANGEROUS = 1;
    static final int EXIT_BLOCKED = 2;

    private PolicyCheckMain() {
    }

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out, System.getenv()));
    }

    static int run(String[] args, PrintStream out, Map<String, String> env) throws IOException {
        int commandStart = 0;
        PolicyConfig config;
        if (args.length >= 2 && "--config".equals(args[0])) {
            Path file = Path.of(args[1]);
            if (!Files.exists(file)) {
                throw new IllegalArgumentException("policy config file not found: " + file);
            }
            config = PolicyConfigs.fromJson(JsonCodec.readTree(Files.readString(file)));
            commandStart = 2;
        } else {
            config = EnvPolicyConfigProvider.fromEnvironment(env).activeConfig();
        }
        if (commandStart >= args.length) {
            throw new IllegalArgumentException("usage: PolicyCheckMain [--config policy.json] <command...>");
        }
        String command = String.join(" ", Arrays.copyOfRange(args, commandStart, args.length));

        Verdict verdict = new DefaultPolicyEngine().evaluate(command, config);

        ObjectNode node = JsonCodec.createObjectNode();
        node.put("command", command);
        node.put("tier", verdict.tier().wireName());
        node.put("reason", verdict.reason());
        node.put("matchedRule", verdict.matchedRule());
        out.println(JsonCodec.writeString(node));

        return switch (verdict.tier()) {
            case SAFE, WARNING -> EXIT_OK;
            case DANGEROUS -> EXIT_DANGEROUS;
            case BLOCKED -> EXIT_BLOCKED;
        };
    }
}
