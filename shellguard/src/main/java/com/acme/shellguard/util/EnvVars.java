package com.acme.shellguard.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Every lookup has a {@code Map} overload so callers can be exercised without touching the process
 * environment.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        long parsed = getLongClamped(env, name, defaultValue, min, max);
        return (int) parsed;
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * Splits a {@code ;}-separated value into trimmed, non-blank items.
     * Returns {@code defaultValue} only when the variable is unset; an explicitly empty value yields an empty list.
     */
    public static List<String> getList(Map<String, String> env, String name, List<String> defaultValue) {
        String raw = env.get(name);
        if (raw == null) {
            return defaultValue;
        }
        List<String> out = new ArrayList<>();
        for (String part : raw.split(";")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                out.add(item);
            }
        }
        return List.copyOf(out);
    }
}
