package dev.shellspec.engine.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Values read from {@code shellspec.toml}. Absent keys stay empty so command-line flags and built-in
 * defaults can fill them.
 */
public record ProjectSettings(
    Optional<Path> source,
    Optional<String> pattern,
    Optional<String> prefix,
    Optional<String> shell,
    Optional<Duration> timeout,
    Optional<Boolean> coverageEnabled,
    OptionalInt coverageThreshold,
    List<Path> coverageTargets,
    Optional<Path> coverageJson,
    Optional<Boolean> coverageIncludeTests,
    Map<String, String> mocks,
    Map<String, String> stubs
) {
    public static final ProjectSettings EMPTY = new ProjectSettings(
        Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
        Optional.empty(), OptionalInt.empty(), List.of(), Optional.empty(), Optional.empty(), Map.of(), Map.of()
    );

    public ProjectSettings {
        coverageTargets = List.copyOf(coverageTargets);
        mocks = Collections.unmodifiableMap(new LinkedHashMap<>(mocks));
        stubs = Collections.unmodifiableMap(new LinkedHashMap<>(stubs));
    }
}
