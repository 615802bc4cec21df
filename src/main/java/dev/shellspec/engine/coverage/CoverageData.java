package dev.shellspec.engine.coverage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Union of every trace record observed during a run.
 */
public final class CoverageData {
    private final Set<TraceRecord> records = new LinkedHashSet<>();

    public void add(TraceRecord record) {
        records.add(record);
    }

    public void merge(Collection<TraceRecord> more) {
        records.addAll(more);
    }

    public Set<TraceRecord> records() {
        return Set.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * Traced files, sorted.
     */
    public SortedSet<Path> files() {
        return records.stream().map(TraceRecord::file).collect(Collectors.toCollection(TreeSet::new));
    }

    public Set<Integer> linesOf(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        return records.stream()
            .filter(record -> record.file().equals(normalized))
            .map(TraceRecord::line)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Stats for one file; {@link CoverageStats#EMPTY} when the file cannot be read.
     */
    public CoverageStats statsFor(Path file) {
        List<String> lines;
        try {
            lines = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).lines().toList();
        } catch (IOException ex) {
            return CoverageStats.EMPTY;
        }
        return CoverageStats.of(lines, linesOf(file));
    }
}
