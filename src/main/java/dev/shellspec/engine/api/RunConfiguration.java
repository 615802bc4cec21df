package dev.shellspec.engine.api;

import dev.shellspec.engine.config.ConfigurationException;
import dev.shellspec.engine.config.ProjectSettings;
import dev.shellspec.engine.discovery.TestPlanner;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable, validated settings of one run.
 */
public record RunConfiguration(
    Path root,
    String pattern,
    String prefix,
    String shell,
    Optional<Duration> timeout,
    boolean tap,
    boolean verbose,
    Optional<Path> jsonResults,
    boolean coverage,
    OptionalInt coverageThreshold,
    Optional<Path> coverageJson,
    List<Path> coverageTargets,
    boolean coverageIncludeTests,
    Map<String, String> mocks,
    Map<String, String> stubs
) {
    public static final String DEFAULT_PATTERN = "*_test.sh";
    public static final String DEFAULT_PREFIX = "test_";
    public static final String DEFAULT_SHELL = "bash";

    public RunConfiguration {
        root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(jsonResults, "jsonResults");
        Objects.requireNonNull(coverageThreshold, "coverageThreshold");
        Objects.requireNonNull(coverageJson, "coverageJson");
        if (pattern == null || pattern.isBlank()) {
            throw new ConfigurationException("Test file pattern must not be empty");
        }
        if (pattern.contains("/")) {
            throw new ConfigurationException("Test file pattern matches file names only: " + pattern);
        }
        TestPlanner.validatePrefix(prefix);
        if (shell == null || shell.isBlank()) {
            throw new ConfigurationException("Shell must not be empty");
        }
        if (coverageThreshold.isPresent() && (coverageThreshold.getAsInt() < 0 || coverageThreshold.getAsInt() > 100)) {
            throw new ConfigurationException("Coverage threshold must be between 0 and 100: " + coverageThreshold.getAsInt());
        }
        coverageTargets = List.copyOf(coverageTargets);
        mocks = Collections.unmodifiableMap(new LinkedHashMap<>(mocks));
        stubs = Collections.unmodifiableMap(new LinkedHashMap<>(stubs));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Coverage is collected when enabled explicitly or implied by a threshold, a JSON report or targets.
     */
    public boolean coverageRequested() {
        return coverage || coverageThreshold.isPresent() || coverageJson.isPresent() || !coverageTargets.isEmpty();
    }

    public static final class Builder {
        private Path root = Path.of(".");
        private String pattern = DEFAULT_PATTERN;
        private String prefix = DEFAULT_PREFIX;
        private String shell = DEFAULT_SHELL;
        private Optional<Duration> timeout = Optional.empty();
        private boolean tap;
        private boolean verbose;
        private Optional<Path> jsonResults = Optional.empty();
        private boolean coverage;
        private OptionalInt coverageThreshold = OptionalInt.empty();
        private Optional<Path> coverageJson = Optional.empty();
        private final List<Path> coverageTargets = new ArrayList<>();
        private boolean coverageIncludeTests;
        private final Map<String, String> mocks = new LinkedHashMap<>();
        private final Map<String, String> stubs = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Copies every value present in the settings file. Call before the command-line overrides.
         */
        public Builder settings(ProjectSettings settings) {
            settings.pattern().ifPresent(this::pattern);
            settings.prefix().ifPresent(this::prefix);
            settings.shell().ifPresent(this::shell);
            settings.timeout().ifPresent(value -> timeout(Optional.of(value)));
            settings.coverageEnabled().ifPresent(this::coverage);
            settings.coverageThreshold().ifPresent(this::coverageThreshold);
            settings.coverageTargets().forEach(this::coverageTarget);
            settings.coverageJson().ifPresent(this::coverageJson);
            settings.coverageIncludeTests().ifPresent(this::coverageIncludeTests);
            settings.mocks().forEach(this::mock);
            settings.stubs().forEach(this::stub);
            return this;
        }

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder shell(String shell) {
            this.shell = shell;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout == null ? Optional.empty() : timeout;
            return this;
        }

        public Builder tap(boolean tap) {
            this.tap = tap;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder jsonResults(Path jsonResults) {
            this.jsonResults = Optional.ofNullable(jsonResults);
            return this;
        }

        public Builder coverage(boolean coverage) {
            this.coverage = coverage;
            return this;
        }

        public Builder coverageThreshold(int threshold) {
            this.coverageThreshold = OptionalInt.of(threshold);
            return this;
        }

        public Builder coverageJson(Path coverageJson) {
            this.coverageJson = Optional.ofNullable(coverageJson);
            return this;
        }

        public Builder coverageTarget(Path target) {
            this.coverageTargets.add(target);
            return this;
        }

        public Builder coverageIncludeTests(boolean include) {
            this.coverageIncludeTests = include;
            return this;
        }

        public Builder mock(String command, String body) {
            this.mocks.put(command, body);
            return this;
        }

        public Builder stub(String function, String body) {
            this.stubs.put(function, body);
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                root,
                pattern,
                prefix,
                shell,
                timeout,
                tap,
                verbose,
                jsonResults,
                coverage,
                coverageThreshold,
                coverageJson,
                coverageTargets,
                coverageIncludeTests,
                mocks,
                stubs
            );
        }
    }
}
