package dev.shellspec.engine.coverage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-file and aggregate coverage for a run, renderable as text or JSON.
 */
public final class CoverageReport {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();

    private final List<FileCoverage> files;
    private final int executable;
    private final int covered;

    private CoverageReport(List<FileCoverage> files) {
        this.files = List.copyOf(files);
        this.executable = files.stream().mapToInt(file -> file.stats().executable()).sum();
        this.covered = files.stream().mapToInt(file -> file.stats().covered()).sum();
    }

    /**
     * Reports every traced file plus the explicit targets, which appear even when nothing ran them.
     */
    public static CoverageReport of(CoverageData data, Path root, Collection<Path> targets) {
        Path base = root.toAbsolutePath().normalize();
        SortedSet<Path> reported = new TreeSet<>(data.files());
        targets.forEach(target -> reported.add(base.resolve(target).normalize()));
        List<FileCoverage> files = new ArrayList<>();
        for (Path file : reported) {
            String display = file.startsWith(base) ? base.relativize(file).toString() : file.toString();
            files.add(new FileCoverage(file, display, data.statsFor(file)));
        }
        return new CoverageReport(files);
    }

    public List<FileCoverage> files() {
        return files;
    }

    public int executable() {
        return executable;
    }

    public int covered() {
        return covered;
    }

    public double percent() {
        return CoverageStats.percent(covered, executable);
    }

    /**
     * Aggregate percentage rounded to a whole number, as compared against the threshold.
     */
    public long roundedPercent() {
        return executable == 0 ? 0 : Math.round(covered * 100.0 / executable);
    }

    public List<String> textLines() {
        List<String> lines = new ArrayList<>();
        for (FileCoverage file : files) {
            lines.add("Coverage: " + file.displayPath());
            lines.add("  Lines: " + file.stats().covered() + "/" + file.stats().executable()
                + " (" + CoverageStats.formatPercent(file.stats().percent()) + "%)");
        }
        lines.add("Total: " + covered + "/" + executable + " (" + CoverageStats.formatPercent(percent()) + "%)");
        return lines;
    }

    public ObjectNode toJson() {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode filesNode = root.putObject("files");
        for (FileCoverage file : files) {
            ObjectNode node = filesNode.putObject(file.displayPath());
            node.put("total_lines", file.stats().executable());
            node.put("covered_lines", file.stats().covered());
            node.put("coverage_percent", file.stats().percent());
            ObjectNode lines = node.putObject("lines");
            for (int line : file.stats().executableLines()) {
                lines.put(Integer.toString(line), file.stats().isCovered(line) ? "covered" : "uncovered");
            }
        }
        ObjectNode summary = root.putObject("summary");
        summary.put("files", files.size());
        summary.put("total_lines", executable);
        summary.put("covered_lines", covered);
        summary.put("coverage_percent", percent());
        return root;
    }

    public String toPrettyJson() {
        try {
            return JSON_WRITER.writeValueAsString(toJson());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize coverage report", ex);
        }
    }

    public void writeJson(Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toPrettyJson() + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write coverage report to " + target, ex);
        }
    }
}
