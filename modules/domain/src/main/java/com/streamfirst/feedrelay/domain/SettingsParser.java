package com.streamfirst.feedrelay.domain;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Parses textual settings as administrators enter them.
 */
public final class SettingsParser {

    private static final Set<String> TRUE_VALUES = Set.of("on", "true", "yes", "1");
    private static final Set<String> FALSE_VALUES = Set.of("off", "false", "no", "0");

    private SettingsParser() {
    }

    /**
     * Parses a delay. Values containing {@code .}, {@code e} or {@code E} are seconds, bare integers
     * are milliseconds. Negative results clamp to zero; blank or malformed input yields the default.
     */
    public static Duration parseDelay(String value, Duration defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String stripped = value.strip();
        try {
            if (stripped.contains(".") || stripped.contains("e") || stripped.contains("E")) {
                double seconds = Double.parseDouble(stripped);
                if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                    return defaultValue;
                }
                return seconds <= 0 ? Duration.ZERO : Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
            }
            long millis = Long.parseLong(stripped);
            return millis <= 0 ? Duration.ZERO : Duration.ofMillis(millis);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean parseBool(String value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        return defaultValue;
    }

    public static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.strip());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Parses a number of seconds that may carry a fraction, e.g. a poll interval of {@code 2.5}.
     */
    public static Duration parseSeconds(String value, Duration defaultValue) {
        double seconds = parseDouble(value, -1);
        if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            return defaultValue;
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    /**
     * Lowercases a username and strips a leading {@code @}. Returns null for blank input.
     */
    public static String normalizeUsername(String username) {
        if (username == null) {
            return null;
        }
        String normalized = username.strip();
        if (normalized.startsWith("@")) {
            normalized = normalized.substring(1);
        }
        normalized = normalized.strip().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }
}
