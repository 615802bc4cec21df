package dev.shellspec.engine.coverage;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One executed source line. Equal records are the same observation; there are no hit counts.
 */
public record TraceRecord(Path file, int line) {
    public TraceRecord {
        file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        if (line < 1) {
            throw new IllegalArgumentException("Line numbers start at 1: " + line);
        }
    }

    /**
     * Parses a {@code <path>:<line>} entry written by the trace hook.
     */
    public static Optional<TraceRecord> parse(String entry) {
        if (entry == null) {
            return Optional.empty();
        }
        int colon = entry.lastIndexOf(':');
        if (colon <= 0 || colon == entry.length() - 1) {
            return Optional.empty();
        }
        try {
            int line = Integer.parseInt(entry.substring(colon + 1).trim());
            if (line < 1) {
                return Optional.empty();
            }
            return Optional.of(new TraceRecord(Path.of(entry.substring(0, colon)), line));
        } catch (RuntimeException ex) {
            return Optional.empty();
        }
    }
}
