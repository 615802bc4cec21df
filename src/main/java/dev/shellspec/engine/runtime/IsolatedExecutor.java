package dev.shellspec.engine.runtime;

import dev.shellspec.engine.coverage.TraceCollector;
import dev.shellspec.engine.coverage.TraceSession;
import dev.shellspec.engine.discovery.TestCase;
import dev.shellspec.engine.shared.DurationParser;
import dev.shellspec.engine.substitution.SubstitutionEntry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each test case in its own freshly started shell. Nothing but the test file and the run-wide
 * substitutions reaches the test: variables, functions and mocks from a sibling test are gone with
 * the process that created them.
 */
public final class IsolatedExecutor {
    private static final Logger log = LoggerFactory.getLogger(IsolatedExecutor.class);

    private final ShellProcess shell;
    private final RunWorkspace workspace;
    private final RuntimeLibrary runtime;
    private final Path workingDirectory;
    private final Optional<Duration> timeout;
    private final List<SubstitutionEntry> hostSubstitutions;
    private final Optional<TraceCollector> tracing;

    private IsolatedExecutor(Builder builder) {
        this.shell = Objects.requireNonNull(builder.shell, "shell");
        this.workspace = Objects.requireNonNull(builder.workspace, "workspace");
        this.runtime = Objects.requireNonNull(builder.runtime, "runtime");
        this.workingDirectory = Objects.requireNonNull(builder.workingDirectory, "workingDirectory");
        this.timeout = builder.timeout;
        this.hostSubstitutions = List.copyOf(builder.hostSubstitutions);
        this.tracing = builder.tracing;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionResult execute(TestCase testCase) {
        var execution = new TestExecution(testCase);
        if (testCase.directive().isSkip()) {
            execution.skip();
            log.debug("Skipping {}: {}", testCase.name(), testCase.directive().reason());
            return ExecutionResult.skipped(testCase);
        }
        execution.start();
        Optional<TraceSession> session = tracing.map(collector -> collector.openSession(testCase.name()));
        try (var context = IsolatedContext.open(workspace, testCase, session)) {
            var installed = context.install(hostSubstitutions);
            Path bootstrap = context.writeBootstrap(
                BootstrapScript.render(workspace.root(), runtime, testCase, installed, context.trace())
            );
            ProcessOutcome outcome = shell.run(List.of(bootstrap.toString()), workingDirectory, timeout);
            String output = outcome.output();
            if (outcome.timedOut()) {
                output = appendLine(output, "timed out after " + timeout.map(DurationParser::format).orElse("?"));
            }
            ExecutionState state = execution.complete(outcome.succeeded());
            log.debug("{} finished with status {} in {} ms: {}", testCase.name(), outcome.exitCode(), outcome.elapsed().toMillis(), state);
            return new ExecutionResult(testCase, state, output, OptionalInt.of(outcome.exitCode()), outcome.elapsed(), outcome.timedOut());
        } finally {
            tracing.ifPresent(collector -> session.ifPresent(collector::absorb));
        }
    }

    private static String appendLine(String output, String line) {
        if (output.isEmpty() || output.endsWith("\n")) {
            return output + line + "\n";
        }
        return output + "\n" + line + "\n";
    }

    public static final class Builder {
        private ShellProcess shell;
        private RunWorkspace workspace;
        private RuntimeLibrary runtime;
        private Path workingDirectory;
        private Optional<Duration> timeout = Optional.empty();
        private List<SubstitutionEntry> hostSubstitutions = List.of();
        private Optional<TraceCollector> tracing = Optional.empty();

        private Builder() {}

        public Builder shell(ShellProcess shell) {
            this.shell = shell;
            return this;
        }

        public Builder workspace(RunWorkspace workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder runtime(RuntimeLibrary runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout == null ? Optional.empty() : timeout;
            return this;
        }

        public Builder hostSubstitutions(List<SubstitutionEntry> hostSubstitutions) {
            this.hostSubstitutions = hostSubstitutions == null ? List.of() : hostSubstitutions;
            return this;
        }

        public Builder tracing(Optional<TraceCollector> tracing) {
            this.tracing = tracing == null ? Optional.empty() : tracing;
            return this;
        }

        public IsolatedExecutor build() {
            return new IsolatedExecutor(this);
        }
    }
}
