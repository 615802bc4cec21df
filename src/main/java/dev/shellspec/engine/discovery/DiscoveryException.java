package dev.shellspec.engine.discovery;

import java.nio.file.Path;

/**
 * Raised when a test file cannot be loaded into a throwaway shell.
 */
public final class DiscoveryException extends RuntimeException {
    private final Path file;

    public DiscoveryException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
