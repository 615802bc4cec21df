package dev.shellspec.engine.runtime;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uniquely named scratch directory owned by one run: extracted runtime, per-test contexts, trace files and
 * result staging. Deleted on {@link #close()}, or by a shutdown hook when the JVM goes down first.
 */
public final class RunWorkspace implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RunWorkspace.class);

    private final Path root;
    private final Path runtimeDirectory;
    private final Path contextsDirectory;
    private final Path tracesDirectory;
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Thread shutdownHook;

    private RunWorkspace(Path root) throws IOException {
        this.root = root;
        this.runtimeDirectory = Files.createDirectories(root.resolve("runtime"));
        this.contextsDirectory = Files.createDirectories(root.resolve("contexts"));
        this.tracesDirectory = Files.createDirectories(root.resolve("traces"));
        this.shutdownHook = new Thread(this::delete, "shellspec-workspace-cleanup");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    public static RunWorkspace create() {
        try {
            Path root = Files.createTempDirectory("shellspec-").toRealPath();
            log.debug("Created run workspace {}", root);
            return new RunWorkspace(root);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create run workspace: " + ex.getMessage(), ex);
        }
    }

    public Path root() {
        return root;
    }

    public Path runtimeDirectory() {
        return runtimeDirectory;
    }

    public Path tracesDirectory() {
        return tracesDirectory;
    }

    public Path resultsStagingFile() {
        return root.resolve("results.jsonl");
    }

    /**
     * Creates a fresh, uniquely numbered directory for one isolated context.
     */
    Path newContextDirectory(String label) {
        String name = String.format("%04d-%s", sequence.incrementAndGet(), sanitize(label));
        try {
            return Files.createDirectories(contextsDirectory.resolve(name));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create context directory " + name, ex);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        delete();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException ignored) {
            // already shutting down; the hook performs the same deletion
        }
    }

    private void delete() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            deleteRecursively(root);
            log.debug("Deleted run workspace {}", root);
        } catch (IOException ex) {
            log.warn("Unable to delete run workspace {}: {}", root, ex.getMessage());
        }
    }

    static String sanitize(String label) {
        String cleaned = label == null ? "" : label.replaceAll("[^A-Za-z0-9_.-]", "_");
        return cleaned.isEmpty() ? "context" : cleaned;
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
