package com.acme.shellguard.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lowercased view of a command line split into list/pipeline segments, used by the heuristic table.
 * Script blocks ({@code { ... }}) start segments of their own, so a command nested in one has a head.
 *
 * <p>This is a coarse tokenizer, not a shell parser: quoting and escapes are ignored, which can only
 * make the heuristics over-match.</p>
 */
final class CommandShape {
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\|\\||&&|[|;\\n{}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ENV_ASSIGNMENT = Pattern.compile("[a-z_][a-z0-9_]*=.*");
    private static final Set<String> PREFIX_WORDS = Set.of(
        "sudo", "doas", "env", "nohup", "time", "command", "exec", "xargs"
    );

    private final String lower;
    private final List<Segment> segments;

    private CommandShape(String lower, List<Segment> segments) {
        this.lower = lower;
        this.segments = segments;
    }

    static CommandShape of(String command) {
        String lower = command == null ? "" : command.toLowerCase(Locale.ROOT).trim();
        List<Segment> segments = new ArrayList<>();
        for (String raw : SEGMENT_SEPARATOR.split(lower)) {
            String trimmed = raw.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            List<String> tokens = List.of(WHITESPACE.split(trimmed));
            segments.add(new Segment(tokens, headIndex(tokens)));
        }
        return new CommandShape(lower, Collections.unmodifiableList(segments));
    }

    String lower() {
        return lower;
    }

    List<Segment> segments() {
        return segments;
    }

    boolean contains(String needle) {
        return lower.contains(needle);
    }

    boolean anyHeadIn(Set<String> names) {
        for (Segment s : segments) {
            if (s.head() != null && names.contains(s.head())) {
                return true;
            }
        }
        return false;
    }

    boolean anyHeadStartsWith(String prefix) {
        for (Segment s : segments) {
            if (s.head() != null && s.head().startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    boolean anyToken(String token) {
        for (Segment s : segments) {
            if (s.tokens().contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static int headIndex(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            String t = tokens.get(i);
            if (PREFIX_WORDS.contains(t) || ENV_ASSIGNMENT.matcher(t).matches()) {
                continue;
            }
            return i;
        }
        return -1;
    }

    record Segment(List<String> tokens, int headIndex) {

        /** Command word with wrapping punctuation, directory and {@code .exe} suffix removed. */
        String head() {
            if (headIndex < 0) {
                return null;
            }
            String word = tokens.get(headIndex);
            while (!word.isEmpty() && "({`$".indexOf(word.charAt(0)) >= 0) {
                word = word.substring(1);
            }
            while (!word.isEmpty() && ")}`".indexOf(word.charAt(word.length() - 1)) >= 0) {
                word = word.substring(0, word.length() - 1);
            }
            int slash = Math.max(word.lastIndexOf('/'), word.lastIndexOf('\\'));
            if (slash >= 0) {
                word = word.substring(slash + 1);
            }
            if (word.endsWith(".exe")) {
                word = word.substring(0, word.length() - 4);
            }
            return word;
        }

        String firstToken() {
            return tokens.isEmpty() ? null : tokens.get(0);
        }

        List<String> arguments() {
            if (headIndex < 0 || headIndex + 1 >= tokens.size()) {
                return List.of();
            }
            return tokens.subList(headIndex + 1, tokens.size());
        }
    }
}
