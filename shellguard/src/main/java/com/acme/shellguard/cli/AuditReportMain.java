package com.acme.shellguard.cli;

import com.acme.shellguard.audit.AuditQuery;
import com.acme.shellguard.audit.AuditStatistics;
import com.acme.shellguard.audit.AuditStoreException;
import com.acme.shellguard.audit.AuditStoreSettings;
import com.acme.shellguard.audit.JsonlAuditStore;
import com.acme.shellguard.policy.SafetyTier;
import com.acme.shellguard.util.JsonCodec;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Prints audit statistics as JSON.
 *
 * <pre>AuditReportMain [logPath] [--user u] [--tier t] [--since iso] [--until iso]</pre>
 *
 * Without a path the configured audit log is used. Exit status 2 when the log cannot be read, 64 when
 * the arguments are invalid.
 */
public final class AuditReportMain {
    static final int EXIT_OK = 0;
    static final int EXIT_STORE_ERROR = 2;
    static final int EXIT_USAGE = 64;
    static final String USAGE = "usage: AuditReportMain [logPath] [--user u] [--tier t] [--since iso] [--until iso]";

    private AuditReportMain() {
    }

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out, System.err,
            AuditStoreSettings.fromEnvironment().logPath()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Path defaultLogPath) throws IOException {
        Path logPath = defaultLogPath;
        AuditQuery query = AuditQuery.all();
        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--user" -> query = query.withUser(value(args, ++i, arg));
                    case "--tier" -> query = query.withTier(SafetyTier.fromWireName(value(args, ++i, arg)));
                    case "--since" -> query = query.between(Instant.parse(value(args, ++i, arg)), query.until());
                    case "--until" -> query = query.between(query.since(), Instant.parse(value(args, ++i, arg)));
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("unknown option: " + arg);
                        }
                        logPath = Path.of(arg);
                    }
                }
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            err.println("audit report: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try (JsonlAuditStore store = JsonlAuditStore.open(logPath)) {
            AuditStatistics stats = store.statistics(query);
            out.println(JsonCodec.writePretty(toJson(logPath, stats)));
            return EXIT_OK;
        } catch (AuditStoreException e) {
            err.println("audit report failed: " + e.reason() + ": " + e.getMessage());
            return EXIT_STORE_ERROR;
        }
    }

    private static ObjectNode toJson(Path logPath, AuditStatistics stats) {
        ObjectNode node = JsonCodec.createObjectNode();
        node.put("logPath", logPath.toString());
        node.put("total", stats.total());
        node.put("executed", stats.executed());
        node.put("failedExecutions", stats.failedExecutions());
        node.put("dangerousOrBlocked", stats.dangerousOrBlocked());
        node.put("malformedLines", stats.malformedLines());
        ObjectNode tiers = node.putObject("perTier");
        for (SafetyTier tier : SafetyTier.values()) {
            tiers.put(tier.wireName(), stats.count(tier));
        }
        return node;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("missing value for " + option);
        }
        return args[index];
    }
}
