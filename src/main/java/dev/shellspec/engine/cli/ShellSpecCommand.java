package dev.shellspec.engine.cli;

import dev.shellspec.engine.api.LogLevel;
import dev.shellspec.engine.api.RunConfiguration;
import dev.shellspec.engine.api.RunResult;
import dev.shellspec.engine.api.ShellSpecRunner;
import dev.shellspec.engine.config.ConfigurationException;
import dev.shellspec.engine.config.ProjectSettings;
import dev.shellspec.engine.config.SettingsLoader;
import dev.shellspec.engine.shared.DurationParser;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "shellspec",
    description = "Discover and run Bash test functions, each in its own shell.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ShellSpecCommand implements Callable<Integer> {
    private final PrintStream out;

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "PATTERN",
        description = "Test file name glob (default: " + RunConfiguration.DEFAULT_PATTERN + ", or the config file's pattern)."
    )
    private String pattern;

    @CommandLine.Option(names = "--root", description = "Directory searched for test files.", defaultValue = ".")
    private Path root;

    @CommandLine.Option(
        names = "--prefix",
        description = "Name prefix of test functions (default: " + RunConfiguration.DEFAULT_PREFIX + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String prefix;

    @CommandLine.Option(names = "--tap", description = "Emit TAP version 13 instead of console lines.")
    private boolean tap;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Show the output of passing tests too.")
    private boolean verbose;

    @CommandLine.Option(
        names = "--json-results",
        paramLabel = "FILE",
        description = "Write all results as one JSON document.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path jsonResults;

    @CommandLine.Option(names = "--coverage", description = "Trace executed lines and report coverage (Bash 4+).")
    private boolean coverage;

    @CommandLine.Option(
        names = "--coverage-threshold",
        paramLabel = "PERCENT",
        description = "Fail the run when aggregate coverage is below this percentage.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer coverageThreshold;

    @CommandLine.Option(
        names = "--coverage-json",
        paramLabel = "FILE",
        description = "Write the coverage report as JSON.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path coverageJson;

    @CommandLine.Option(
        names = "--coverage-target",
        paramLabel = "FILE",
        description = "Source file always included in the coverage report (repeatable)."
    )
    private List<Path> coverageTargets = new ArrayList<>();

    @CommandLine.Option(
        names = "--timeout",
        description = "Per-test timeout (e.g. 30s, 2m); none by default.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--shell",
        description = "Bash executable (default: " + RunConfiguration.DEFAULT_SHELL + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String shell;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "Settings file (default: <root>/" + SettingsLoader.DEFAULT_FILE + " when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Engine log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    ShellSpecCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        resolveLogLevel().install();
        RunConfiguration configuration = buildConfiguration();
        RunResult result = new ShellSpecRunner(out).run(configuration);
        return result.status().exitCode();
    }

    RunConfiguration buildConfiguration() {
        Path resolvedRoot = Paths.get("").toAbsolutePath().resolve(root).normalize();
        ProjectSettings settings = SettingsLoader.locate(resolvedRoot, Optional.ofNullable(config));

        var builder = RunConfiguration.builder()
            .settings(settings)
            .root(resolvedRoot)
            .tap(tap)
            .verbose(verbose);
        if (pattern != null) {
            builder.pattern(pattern);
        }
        if (prefix != null) {
            builder.prefix(prefix);
        }
        if (shell != null) {
            builder.shell(shell);
        }
        if (timeoutRaw != null) {
            try {
                builder.timeout(DurationParser.parse(timeoutRaw));
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException("Invalid --timeout: " + ex.getMessage(), ex);
            }
        }
        if (jsonResults != null) {
            builder.jsonResults(jsonResults.toAbsolutePath());
        }
        if (coverage) {
            builder.coverage(true);
        }
        if (coverageThreshold != null) {
            builder.coverageThreshold(coverageThreshold);
        }
        if (coverageJson != null) {
            builder.coverageJson(coverageJson.toAbsolutePath());
        }
        coverageTargets.forEach(target -> builder.coverageTarget(target.toAbsolutePath()));
        return builder.build();
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }
}
