package dev.shellspec.engine.discovery;

import java.nio.file.Path;

/**
 * A test file that could not be loaded; discovery carried on without it.
 */
public record DiscoveryFailure(Path file, String displayPath, String message) {}
