package dev.shellspec.engine.coverage;

import java.nio.file.Path;

/**
 * Trace file handed to a single test shell.
 */
public record TraceSession(String label, Path file) {}
