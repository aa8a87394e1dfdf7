package io.tagkeeper.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations such as {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h}
 * or ISO-8601 ({@code PT5M}). A bare number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {
    }

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("pt")) {
            try {
                return Optional.of(Duration.parse(trimmed.toUpperCase(Locale.ROOT)));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + raw, e);
            }
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + raw, e);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        try {
            return Optional.of(Duration.ofMillis(Math.multiplyExact(value, multiplier)));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid duration: " + raw + " is out of range", e);
        }
    }

    public static Duration parseOrDefault(String raw, Duration fallback) {
        return parse(raw).orElse(fallback);
    }
}
