package dev.shellspec.engine.coverage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands a fresh trace file to each test shell and folds what it recorded into the run's
 * {@link CoverageData}. Absorbing the same records twice changes nothing.
 */
public final class TraceCollector {
    private static final Logger log = LoggerFactory.getLogger(TraceCollector.class);

    /** Records buffered by the trace hook before each append to the trace file. */
    public static final int BATCH_SIZE = 50;

    private final Path directory;
    private final Set<Path> excluded;
    private final CoverageData data = new CoverageData();
    private final AtomicInteger sequence = new AtomicInteger();

    /**
     * @param directory where session files are created
     * @param excluded files never counted, such as the test files themselves
     */
    public TraceCollector(Path directory, Set<Path> excluded) {
        this.directory = directory;
        this.excluded = excluded.stream().map(path -> path.toAbsolutePath().normalize()).collect(Collectors.toUnmodifiableSet());
    }

    public TraceSession openSession(String label) {
        String name = String.format("%04d-%s.trace", sequence.incrementAndGet(), label.replaceAll("[^A-Za-z0-9_.-]", "_"));
        return new TraceSession(label, directory.resolve(name));
    }

    /**
     * Reads and deletes a session file. A test that never reached the trace hook leaves no file.
     */
    public void absorb(TraceSession session) {
        Path file = session.file();
        if (!Files.exists(file)) {
            log.debug("No trace recorded for {}", session.label());
            return;
        }
        try {
            List<String> entries = Files.readAllLines(file, StandardCharsets.UTF_8);
            absorb(entries);
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Unable to read trace for {}: {}", session.label(), ex.getMessage());
        }
    }

    void absorb(List<String> entries) {
        for (String entry : entries) {
            TraceRecord.parse(entry)
                .filter(record -> !excluded.contains(record.file()))
                .ifPresent(data::add);
        }
    }

    public CoverageData data() {
        return data;
    }
}
