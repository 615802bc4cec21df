package dev.shellspec.engine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.shellspec.engine.runtime.ExecutionResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stages one JSON line per result in the run workspace and, when asked, writes the aggregated
 * {@code {summary, results}} document once the run is over.
 */
public final class ResultStream implements RunListener {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Path staging;
    private final Optional<Path> document;
    private final List<ResultRecord> records = new ArrayList<>();

    public ResultStream(Path staging, Optional<Path> document) {
        this.staging = staging;
        this.document = document;
    }

    @Override
    public void testFinished(int sequence, ExecutionResult result) {
        ResultRecord record = ResultRecord.from(result);
        records.add(record);
        try {
            Files.writeString(
                staging,
                JSON.writeValueAsString(record) + "\n",
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to stage result for " + record.test(), ex);
        }
    }

    @Override
    public void runFinished(RunSummary summary) {
        document.ifPresent(target -> write(target, summary));
    }

    public List<ResultRecord> records() {
        return List.copyOf(records);
    }

    /**
     * Records read back from the staging file, in the order they were written.
     */
    public List<ResultRecord> staged() {
        if (!Files.exists(staging)) {
            return List.of();
        }
        try {
            List<ResultRecord> staged = new ArrayList<>();
            for (String line : Files.readAllLines(staging, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    staged.add(JSON.readValue(line, ResultRecord.class));
                }
            }
            return staged;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read staged results", ex);
        }
    }

    String render(RunSummary summary) {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode totals = root.putObject("summary");
        totals.put("total", summary.total());
        totals.put("passed", summary.passed());
        totals.put("failed", summary.failed());
        totals.put("skipped", summary.skipped());
        totals.put("todo", summary.todo());
        root.set("results", JSON.valueToTree(staged()));
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize results", ex);
        }
    }

    private void write(Path target, RunSummary summary) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, render(summary) + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write results to " + target, ex);
        }
    }
}
