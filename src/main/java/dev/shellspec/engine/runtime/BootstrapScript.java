package dev.shellspec.engine.runtime;

import static dev.shellspec.engine.shared.ShellQuoting.quote;

import dev.shellspec.engine.coverage.TraceCollector;
import dev.shellspec.engine.coverage.TraceSession;
import dev.shellspec.engine.discovery.TestCase;
import dev.shellspec.engine.substitution.SubstitutionEntry;
import dev.shellspec.engine.substitution.SubstitutionScript;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Renders the script a test shell runs: load the runtime, arm the EXIT trap that restores substitutions,
 * load the test file, invoke the one test function and exit with its completion status.
 */
final class BootstrapScript {
    private BootstrapScript() {}

    static String render(
        Path home,
        RuntimeLibrary runtime,
        TestCase testCase,
        List<SubstitutionEntry> substitutions,
        Optional<TraceSession> trace
    ) {
        var script = new StringBuilder();
        script.append("# shellspec bootstrap for ")
            .append(testCase.displayFile()).append(' ').append(testCase.name()).append('\n');
        script.append("__SHELLSPEC_HOME=").append(quote(home.toString())).append('\n');
        script.append("__SHELLSPEC_TEST_FILE=").append(quote(testCase.file().path().toString())).append('\n');
        script.append("__SHELLSPEC_TEST_NAME=").append(quote(testCase.name())).append('\n');
        script.append(SubstitutionScript.forbiddenCommandsArray("__SHELLSPEC_FORBIDDEN_COMMANDS"));
        script.append("source ").append(quote(runtime.file(RuntimeLibrary.ASSERTIONS).toString())).append('\n');
        script.append("source ").append(quote(runtime.file(RuntimeLibrary.SUBSTITUTION).toString())).append('\n');
        if (trace.isPresent()) {
            script.append("__SHELLSPEC_TRACE_BATCH=").append(TraceCollector.BATCH_SIZE).append('\n');
            script.append("source ").append(quote(runtime.file(RuntimeLibrary.TRACE).toString())).append('\n');
        }

        script.append("__shellspec_finish() {\n");
        script.append("    local status=$?\n");
        script.append("    trap - EXIT\n");
        script.append("    if [ \"$status\" -eq 0 ] && [ \"${__SHELLSPEC_ASSERTIONS_FAILED:-0}\" -gt 0 ]; then\n");
        script.append("        status=1\n");
        script.append("    fi\n");
        if (trace.isPresent()) {
            script.append("    __shellspec_trace_finish\n");
        }
        script.append("    unmock_all\n");
        script.append("    exit \"$status\"\n");
        script.append("}\n");
        script.append("trap '__shellspec_finish' EXIT\n");

        trace.ifPresent(session -> script.append("__shellspec_trace_start ")
            .append(quote(session.file().toString())).append('\n'));
        script.append("source \"$__SHELLSPEC_TEST_FILE\"\n");
        script.append(SubstitutionScript.install(substitutions));
        script.append("\"$__SHELLSPEC_TEST_NAME\"\n");
        script.append("__shellspec_status=$?\n");
        script.append("if [ \"$__shellspec_status\" -eq 0 ] && [ \"$__SHELLSPEC_ASSERTIONS_FAILED\" -gt 0 ]; then\n");
        script.append("    __shellspec_status=1\n");
        script.append("fi\n");
        script.append("exit \"$__shellspec_status\"\n");
        return script.toString();
    }
}
