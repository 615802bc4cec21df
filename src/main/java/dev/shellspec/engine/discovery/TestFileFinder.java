package dev.shellspec.engine.discovery;

import dev.shellspec.engine.config.ConfigurationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Walks a directory tree for files whose name matches a glob. Hidden directories are not descended.
 */
public final class TestFileFinder {
    private TestFileFinder() {}

    /**
     * @return absolute, normalized paths sorted by their path relative to {@code root}
     */
    public static List<Path> find(Path root, String glob) {
        PathMatcher matcher = matcher(glob);
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            throw new ConfigurationException("Test root is not a directory: " + base);
        }
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(base, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(base) && isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && matcher.matches(file.getFileName())) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to scan " + base + ": " + ex.getMessage(), ex);
        }
        found.sort(Comparator.comparing(path -> base.relativize(path).toString()));
        return List.copyOf(found);
    }

    static PathMatcher matcher(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new ConfigurationException("Test file pattern must not be empty");
        }
        if (glob.contains("/")) {
            throw new ConfigurationException("Test file pattern matches file names only: " + glob);
        }
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + glob);
        } catch (PatternSyntaxException ex) {
            throw new ConfigurationException("Invalid test file pattern '" + glob + "': " + ex.getDescription(), ex);
        }
    }

    private static boolean isHidden(Path dir) {
        Path name = dir.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
