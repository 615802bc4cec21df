package dev.shellspec.engine.runtime;

import dev.shellspec.engine.coverage.TraceSession;
import dev.shellspec.engine.discovery.TestCase;
import dev.shellspec.engine.substitution.SubstitutionEntry;
import dev.shellspec.engine.substitution.SubstitutionKind;
import dev.shellspec.engine.substitution.SubstitutionRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything one test owns while it runs: a private directory, its substitution registry and its trace
 * session. Closing the context resets the registry and removes the directory, whatever the outcome.
 */
final class IsolatedContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IsolatedContext.class);
    static final String BOOTSTRAP_FILE = "bootstrap.sh";

    private final TestCase testCase;
    private final Path directory;
    private final SubstitutionRegistry registry;
    private final Optional<TraceSession> trace;
    private boolean closed;

    private IsolatedContext(TestCase testCase, Path directory, Optional<TraceSession> trace) {
        this.testCase = testCase;
        this.directory = directory;
        this.registry = new SubstitutionRegistry(testCase.file());
        this.trace = trace;
    }

    static IsolatedContext open(RunWorkspace workspace, TestCase testCase, Optional<TraceSession> trace) {
        Path directory = workspace.newContextDirectory(testCase.name());
        log.debug("Opened context {} for {}::{}", directory.getFileName(), testCase.displayFile(), testCase.name());
        return new IsolatedContext(testCase, directory, trace);
    }

    Optional<TraceSession> trace() {
        return trace;
    }

    /**
     * Registers run-wide substitutions in this context's registry and returns them as installed.
     */
    List<SubstitutionEntry> install(List<SubstitutionEntry> hostSubstitutions) {
        for (SubstitutionEntry entry : hostSubstitutions) {
            if (entry.kind() == SubstitutionKind.COMMAND) {
                registry.mockCommand(entry.target(), entry.body());
            } else {
                registry.stubProcedure(entry.target(), entry.body());
            }
            if (log.isTraceEnabled()) {
                Optional<String> active = entry.kind() == SubstitutionKind.COMMAND
                    ? registry.resolveCommand(entry.target())
                    : registry.resolveProcedure(entry.target());
                log.trace("{} {} resolves to {}", entry.kind().shellFunction(), entry.target(), active.orElse("<none>"));
            }
        }
        return registry.entries();
    }

    Path writeBootstrap(String script) {
        Path bootstrap = directory.resolve(BOOTSTRAP_FILE);
        try {
            Files.writeString(bootstrap, script, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write bootstrap for " + testCase.name(), ex);
        }
        return bootstrap;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        var removed = registry.removeAll();
        if (!removed.isEmpty()) {
            log.debug("Reset {} substitution(s) for {}", removed.size(), testCase.name());
        }
        try {
            RunWorkspace.deleteRecursively(directory);
        } catch (IOException ex) {
            log.warn("Unable to delete context directory {}: {}", directory, ex.getMessage());
        }
    }
}
