package dev.shellspec.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.shellspec.engine.report.RunSummary;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a {@link ShellSpecRunner} run (usable by the CLI and embedding apps).
 */
public record RunResult(Status status, Optional<RunSummary> summary, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult of(RunSummary summary, boolean successful, Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(successful ? Status.SUCCESS : Status.FAILURE, Optional.of(summary), metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new RunResult(Status.FAILURE, Optional.empty(), meta, startedAt, Instant.now());
    }

    public boolean successful() {
        return status == Status.SUCCESS;
    }

    public Optional<String> error() {
        return Optional.ofNullable(metadata.get("error")).map(Object::toString);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        summary.ifPresent(totals -> {
            Map<String, Object> counts = new LinkedHashMap<>();
            counts.put("total", totals.total());
            counts.put("passed", totals.passed());
            counts.put("failed", totals.failed());
            counts.put("skipped", totals.skipped());
            counts.put("todo", totals.todo());
            serializable.put("summary", counts);
        });
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
