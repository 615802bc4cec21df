package dev.shellspec.engine.api;

import dev.shellspec.engine.coverage.CoverageReport;
import dev.shellspec.engine.coverage.ThresholdCheck;
import dev.shellspec.engine.coverage.TraceCollector;
import dev.shellspec.engine.discovery.DeclarationLoader;
import dev.shellspec.engine.discovery.DiscoveryFailure;
import dev.shellspec.engine.discovery.ExecutionPlan;
import dev.shellspec.engine.discovery.TestCase;
import dev.shellspec.engine.discovery.TestPlanner;
import dev.shellspec.engine.report.ConsoleReporter;
import dev.shellspec.engine.report.ResultStream;
import dev.shellspec.engine.report.RunListener;
import dev.shellspec.engine.report.RunSummary;
import dev.shellspec.engine.report.TapReporter;
import dev.shellspec.engine.runtime.ExecutionResult;
import dev.shellspec.engine.runtime.IsolatedExecutor;
import dev.shellspec.engine.runtime.RunWorkspace;
import dev.shellspec.engine.runtime.RuntimeLibrary;
import dev.shellspec.engine.runtime.ShellCapabilities;
import dev.shellspec.engine.runtime.ShellProcess;
import dev.shellspec.engine.runtime.SubstitutionValidator;
import dev.shellspec.engine.substitution.SubstitutionEntry;
import dev.shellspec.engine.substitution.SubstitutionException;
import dev.shellspec.engine.substitution.SubstitutionKind;
import dev.shellspec.engine.substitution.SubstitutionRegistry;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point: discover, run every test in isolation, report, and summarise.
 */
public final class ShellSpecRunner {
    private static final Logger log = LoggerFactory.getLogger(ShellSpecRunner.class);

    private final PrintStream out;
    private final List<RunListener> extraListeners;

    public ShellSpecRunner() {
        this(System.out);
    }

    public ShellSpecRunner(PrintStream out) {
        this(out, List.of());
    }

    /**
     * @param extraListeners notified after the built-in reporters, e.g. by embedding applications
     */
    public ShellSpecRunner(PrintStream out, List<RunListener> extraListeners) {
        this.out = out;
        this.extraListeners = List.copyOf(extraListeners);
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        List<RunListener> listeners = new ArrayList<>();
        listeners.add(configuration.tap() ? new TapReporter(out) : new ConsoleReporter(out, configuration.verbose()));
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("root", configuration.root().toString());
        try (var workspace = RunWorkspace.create()) {
            listeners.add(new ResultStream(workspace.resultsStagingFile(), configuration.jsonResults()));
            listeners.addAll(extraListeners);
            return execute(configuration, workspace, listeners, metadata, started);
        } catch (RuntimeException ex) {
            if (Boolean.getBoolean("shellspec.debug")) {
                ex.printStackTrace();
            }
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            log.error("Run aborted: {}", message);
            listeners.forEach(listener -> listener.aborted(message));
            return RunResult.failure(message, metadata, started);
        }
    }

    private RunResult execute(
        RunConfiguration configuration,
        RunWorkspace workspace,
        List<RunListener> listeners,
        Map<String, Object> metadata,
        Instant started
    ) {
        var capabilities = ShellCapabilities.probe(configuration.shell());
        if (!capabilities.available()) {
            throw new IllegalStateException("Shell not runnable: " + configuration.shell());
        }
        log.debug("Using {}", capabilities.describe());
        var shell = new ShellProcess(configuration.shell());
        List<SubstitutionEntry> hostSubstitutions = hostSubstitutions(
            configuration,
            new SubstitutionValidator(shell, capabilities, configuration.root())
        );

        var planner = new TestPlanner(new DeclarationLoader(shell, configuration.timeout()));
        ExecutionPlan plan = planner.plan(configuration.root(), configuration.pattern(), configuration.prefix());

        Optional<TraceCollector> tracing = Optional.empty();
        List<String> coverageNotes = new ArrayList<>();
        if (configuration.coverageRequested()) {
            if (capabilities.supportsTracing()) {
                Set<Path> excluded = configuration.coverageIncludeTests() ? Set.of() : testFiles(plan);
                tracing = Optional.of(new TraceCollector(workspace.tracesDirectory(), excluded));
            } else {
                String warning = "Coverage unavailable: " + capabilities.describe() + " has no usable DEBUG trap (Bash "
                    + ShellCapabilities.MINIMUM_TRACING_VERSION + "+ required)";
                log.warn(warning);
                coverageNotes.add(warning);
            }
        }

        var executor = IsolatedExecutor.builder()
            .shell(shell)
            .workspace(workspace)
            .runtime(RuntimeLibrary.extract(workspace))
            .workingDirectory(configuration.root())
            .timeout(configuration.timeout())
            .hostSubstitutions(hostSubstitutions)
            .tracing(tracing)
            .build();

        listeners.forEach(listener -> listener.planned(plan));
        List<ExecutionResult> results = new ArrayList<>();
        int sequence = 0;
        for (TestCase testCase : plan.cases()) {
            ExecutionResult result = executor.execute(testCase);
            results.add(result);
            int number = ++sequence;
            listeners.forEach(listener -> listener.testFinished(number, result));
        }

        boolean coverageMet = true;
        if (tracing.isPresent()) {
            var report = CoverageReport.of(tracing.get().data(), configuration.root(), configuration.coverageTargets());
            coverageNotes.addAll(report.textLines());
            configuration.coverageJson().ifPresent(target -> report.writeJson(configuration.root().resolve(target)));
            metadata.put("coverage", report.percent());
            if (configuration.coverageThreshold().isPresent()) {
                Optional<String> shortfall = new ThresholdCheck(configuration.coverageThreshold().getAsInt()).evaluate(report);
                if (shortfall.isPresent()) {
                    coverageMet = false;
                    coverageNotes.add(shortfall.get());
                    metadata.put("error", shortfall.get());
                }
            }
        }
        coverageNotes.forEach(note -> listeners.forEach(listener -> listener.note(note)));

        var summary = RunSummary.of(results, plan.failures().size(), Duration.between(started, Instant.now()));
        listeners.forEach(listener -> listener.runFinished(summary));
        metadata.put("files", plan.fileCount());
        if (!plan.failures().isEmpty()) {
            metadata.put("discoveryFailures", plan.failures().stream().map(DiscoveryFailure::displayPath).toList());
        }
        return RunResult.of(summary, summary.successful() && coverageMet, metadata, started);
    }

    /**
     * Validates the run-wide mocks and stubs against the registry rules and the configured shell. Invalid
     * entries are reported and left out; they never stop the run.
     */
    static List<SubstitutionEntry> hostSubstitutions(RunConfiguration configuration, SubstitutionValidator validator) {
        var registry = new SubstitutionRegistry();
        configuration.mocks().forEach((command, body) -> admit(registry, validator, SubstitutionKind.COMMAND, command, body));
        configuration.stubs().forEach((function, body) -> admit(registry, validator, SubstitutionKind.PROCEDURE, function, body));
        return registry.entries();
    }

    private static void admit(
        SubstitutionRegistry registry,
        SubstitutionValidator validator,
        SubstitutionKind kind,
        String target,
        String body
    ) {
        try {
            if (registry.isSubstituted(target)) {
                throw new SubstitutionException(SubstitutionException.Reason.CONFLICTING_TARGET, kind, kind.shellFunction(), target);
            }
            SubstitutionEntry entry = kind == SubstitutionKind.COMMAND
                ? registry.mockCommand(target, body)
                : registry.stubProcedure(target, body);
            try {
                validator.validate(entry);
            } catch (SubstitutionException ex) {
                if (kind == SubstitutionKind.COMMAND) {
                    registry.unmockCommand(target);
                } else {
                    registry.unstubProcedure(target);
                }
                throw ex;
            }
        } catch (SubstitutionException ex) {
            log.warn("Ignoring configured {}: {}", kind == SubstitutionKind.COMMAND ? "mock" : "stub", ex.getMessage());
        }
    }

    private static Set<Path> testFiles(ExecutionPlan plan) {
        return new LinkedHashSet<>(plan.files());
    }
}
