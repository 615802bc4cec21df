package dev.shellspec.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations (e.g. {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h}) used for per-test timeouts.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed) || "none".equals(trimmed)) {
            return Optional.empty();
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
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return value == 0 ? Optional.empty() : Optional.of(Duration.ofMillis(value * multiplier));
    }

    /**
     * Renders a duration the way {@link #parse(String)} accepts it, picking the largest exact unit.
     */
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 3_600_000L == 0 && millis > 0) {
            return (millis / 3_600_000L) + "h";
        }
        if (millis % 60_000L == 0 && millis > 0) {
            return (millis / 60_000L) + "m";
        }
        if (millis % 1_000L == 0 && millis > 0) {
            return (millis / 1_000L) + "s";
        }
        return millis + "ms";
    }
}
