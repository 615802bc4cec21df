package dev.shellspec.engine.coverage;

import java.nio.file.Path;

/**
 * Stats for one reported file.
 *
 * @param displayPath path relative to the run root when inside it, absolute otherwise
 */
public record FileCoverage(Path file, String displayPath, CoverageStats stats) {}
