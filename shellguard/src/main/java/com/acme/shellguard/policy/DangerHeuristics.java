package com.acme.shellguard.policy;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Built-in danger patterns applied when no allow/deny rule decides a command.
 *
 * <p>The table is immutable and its order is significant: the most severe match wins and, among
 * equally severe matches, the first declared entry wins.</p>
 */
public final class DangerHeuristics {
    private static final Set<String> DELETE_HEADS = Set.of(
        "rm", "rmdir", "del", "erase", "rd", "deltree", "remove-item", "ri"
    );
    private static final Set<String> CLUSTERED_FLAG_DELETE_HEADS = Set.of("rm", "rmdir");
    private static final Set<String> MOVE_HEADS = Set.of("mv", "move", "move-item");
    private static final Set<String> SESSION_REMOVAL_HEADS = Set.of(
        "remove-module", "remove-psdrive", "remove-variable", "remove-itemproperty"
    );
    private static final Set<String> RECURSIVE_OR_FORCE_FLAGS = Set.of(
        "--recursive", "--force", "-recurse", "-force", "-recurse:$true", "-force:$true",
        "/s", "/q", "/f"
    );
    private static final Pattern FLAG_CLUSTER = Pattern.compile("-[a-z]+");
    private static final int ABBREVIATED_FLAG_MAX_LENGTH = 5;
    private static final Set<String> DISK_HEADS = Set.of(
        "fdisk", "sfdisk", "gdisk", "parted", "wipefs", "shred", "diskpart", "format", "dd",
        "clear-disk", "format-volume"
    );
    private static final Pattern EXECUTION_POLICY_BYPASS = Pattern.compile("-(executionpolicy|ep)\\s+(bypass|unrestricted)");
    private static final Pattern DEVICE_TARGET = Pattern.compile("(>|of=)\\s*/dev/(sd|nvme|hd|disk|mmcblk|xvd|vd)");
    private static final Pattern PIPE_TO_SHELL = Pattern.compile("\\b(curl|wget)\\b[^|]*\\|\\s*(sudo\\s+)?(ba|z|k|da|fi)?sh\\b");
    private static final Set<String> REMOTE_CODE_HEADS = Set.of(
        "invoke-expression", "iex", "invoke-command", "icm", "invoke-webrequest", "iwr"
    );
    private static final Set<String> ESCALATION_WORDS = Set.of("sudo", "su", "doas", "runas");
    private static final Pattern RUN_AS_ADMIN = Pattern.compile("-verb\\s+runas");
    // '>', 'n>', '&>' and '>|' truncate; '>>' and fd duplication do not, nor does a null device target
    private static final Pattern OVERWRITE_REDIRECT =
        Pattern.compile("(?<!>)>(?![>&])(?!\\|?\\s*(/dev/null|nul\\b|\\$null))");
    private static final Set<String> PERMISSION_HEADS = Set.of("chmod", "chown", "chgrp", "icacls", "takeown", "setfacl");
    private static final Set<String> SHUTDOWN_HEADS = Set.of(
        "shutdown", "reboot", "halt", "poweroff", "restart-computer", "stop-computer"
    );
    private static final Set<String> PROCESS_HEADS = Set.of(
        "kill", "killall", "pkill", "taskkill", "stop-service", "remove-service", "stop-process",
        "restart-service", "reset-service", "start-process"
    );

    private static final List<Heuristic> TABLE = List.of(
        new Heuristic("recursive-forced-delete", SafetyTier.DANGEROUS,
            "Recursive or forced deletion can be dangerous",
            DangerHeuristics::isRecursiveOrForcedDelete),
        new Heuristic("disk-wipe", SafetyTier.DANGEROUS,
            "Disk partitioning or wiping utility can destroy data",
            shape -> shape.anyHeadIn(DISK_HEADS) || shape.anyHeadStartsWith("mkfs")),
        new Heuristic("execution-policy-tampering", SafetyTier.DANGEROUS,
            "Changing the script execution policy weakens system protections",
            shape -> shape.contains("set-executionpolicy") || EXECUTION_POLICY_BYPASS.matcher(shape.lower()).find()),
        new Heuristic("device-overwrite", SafetyTier.DANGEROUS,
            "Writing directly to a block device destroys its contents",
            shape -> DEVICE_TARGET.matcher(shape.lower()).find()),
        new Heuristic("remote-script-execution", SafetyTier.DANGEROUS,
            "Fetching or executing remote or dynamically built code",
            shape -> PIPE_TO_SHELL.matcher(shape.lower()).find() || shape.anyHeadIn(REMOTE_CODE_HEADS)),
        new Heuristic("privilege-escalation", SafetyTier.WARNING,
            "Command runs with elevated privileges",
            DangerHeuristics::isEscalated),
        new Heuristic("file-overwrite-redirection", SafetyTier.WARNING,
            "File redirection (>) will overwrite existing files",
            shape -> OVERWRITE_REDIRECT.matcher(shape.lower()).find()),
        new Heuristic("destructive-file-operation", SafetyTier.WARNING,
            "Command deletes or moves files or session state",
            shape -> shape.anyHeadIn(DELETE_HEADS) || shape.anyHeadIn(MOVE_HEADS)
                || shape.anyHeadIn(SESSION_REMOVAL_HEADS)),
        new Heuristic("permission-change", SafetyTier.WARNING,
            "Command changes file ownership or permissions",
            shape -> shape.anyHeadIn(PERMISSION_HEADS)),
        new Heuristic("confirmation-suppressed", SafetyTier.WARNING,
            "Flag suppresses confirmation or safety checks",
            shape -> shape.contains("-force") || shape.contains("-confirm:$false")
                || shape.contains("--no-preserve-root") || shape.anyToken("/y")),
        new Heuristic("system-shutdown", SafetyTier.WARNING,
            "Command shuts down or restarts the machine",
            shape -> shape.anyHeadIn(SHUTDOWN_HEADS)),
        new Heuristic("process-or-service-control", SafetyTier.WARNING,
            "Command stops processes or services",
            shape -> shape.anyHeadIn(PROCESS_HEADS))
    );

    private DangerHeuristics() {
    }

    public static List<Heuristic> table() {
        return TABLE;
    }

    /**
     * Returns the most severe heuristic matching {@code command}, or null if none does.
     */
    public static Heuristic strongestMatch(String command) {
        CommandShape shape = CommandShape.of(command);
        if (shape.segments().isEmpty()) {
            return null;
        }
        Heuristic best = null;
        for (Heuristic h : TABLE) {
            if (best != null && !h.tier().isMoreSevereThan(best.tier())) {
                continue;
            }
            if (h.trigger().test(shape)) {
                best = h;
            }
        }
        return best;
    }

    private static boolean isRecursiveOrForcedDelete(CommandShape shape) {
        for (CommandShape.Segment s : shape.segments()) {
            String head = s.head();
            if (head == null || !DELETE_HEADS.contains(head)) {
                continue;
            }
            for (String arg : s.arguments()) {
                if (RECURSIVE_OR_FORCE_FLAGS.contains(arg)) {
                    return true;
                }
                if (isShortFlagCluster(head, arg) && (arg.indexOf('r') > 0 || arg.indexOf('f') > 0)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * {@code rm -rfvid} style clusters of any length; for other delete commands only short forms such as
     * PowerShell's abbreviated {@code -rec} or {@code -fo}, so {@code -LiteralPath} does not count.
     */
    private static boolean isShortFlagCluster(String head, String arg) {
        if (!FLAG_CLUSTER.matcher(arg).matches()) {
            return false;
        }
        return CLUSTERED_FLAG_DELETE_HEADS.contains(head) || arg.length() <= ABBREVIATED_FLAG_MAX_LENGTH;
    }

    private static boolean isEscalated(CommandShape shape) {
        if (RUN_AS_ADMIN.matcher(shape.lower()).find()) {
            return true;
        }
        for (CommandShape.Segment s : shape.segments()) {
            String first = s.firstToken();
            if (first != null && ESCALATION_WORDS.contains(first)) {
                return true;
            }
        }
        return false;
    }

    /**
     * One row of the table. {@code id} is reported as {@code heuristic:<id>} in verdicts.
     */
    public record Heuristic(String id, SafetyTier tier, String reason, Predicate<CommandShape> trigger) {
        public String ruleName() {
            return "heuristic:" + id;
        }
    }
}
