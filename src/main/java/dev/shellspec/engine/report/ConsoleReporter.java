package dev.shellspec.engine.report;

import dev.shellspec.engine.discovery.DiscoveryFailure;
import dev.shellspec.engine.discovery.ExecutionPlan;
import dev.shellspec.engine.runtime.ExecutionResult;
import dev.shellspec.engine.runtime.ExecutionState;
import java.io.PrintStream;

/**
 * Plain progress lines for humans. Output of a test is shown when it failed, or always when verbose.
 */
public final class ConsoleReporter implements RunListener {
    private final PrintStream out;
    private final boolean verbose;

    public ConsoleReporter(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    @Override
    public void planned(ExecutionPlan plan) {
        for (DiscoveryFailure failure : plan.failures()) {
            out.println("ERROR: failed to load " + failure.displayPath() + ": " + failure.message());
        }
        if (plan.isEmpty()) {
            out.println("No tests found.");
        } else {
            out.println("Found " + plan.total() + (plan.total() == 1 ? " test." : " tests."));
        }
        out.flush();
    }

    @Override
    public void testFinished(int sequence, ExecutionResult result) {
        out.println(headline(result));
        boolean showOutput = verbose
            || result.state() == ExecutionState.FAILED
            || result.state() == ExecutionState.EXPECTED_FAIL;
        if (showOutput) {
            String output = AnsiText.strip(result.output()).stripTrailing();
            if (!output.isEmpty()) {
                output.lines().forEach(line -> out.println("    " + line));
            }
        }
        out.flush();
    }

    static String headline(ExecutionResult result) {
        var directive = result.testCase().directive();
        String name = result.testCase().name();
        return switch (result.state()) {
            case SKIPPED -> "SKIP: " + name + (directive.reason().isEmpty() ? "" : " (" + directive.reason() + ")");
            case EXPECTED_FAIL -> "TODO: " + name + " (" + result.durationMillis() + "ms)"
                + (directive.reason().isEmpty() ? "" : " " + directive.reason());
            case UNEXPECTED_PASS -> "PASS: " + name + " (" + result.durationMillis() + "ms) # TODO passed unexpectedly";
            case PASSED -> "PASS: " + name + " (" + result.durationMillis() + "ms)";
            default -> "FAIL: " + name + " (" + result.durationMillis() + "ms)";
        };
    }

    @Override
    public void note(String line) {
        out.println(line);
    }

    @Override
    public void aborted(String message) {
        out.println("ERROR: " + message);
        out.flush();
    }

    @Override
    public void runFinished(RunSummary summary) {
        out.println();
        out.println("Results: " + summary.passed() + " passed, " + summary.failed() + " failed, "
            + summary.skipped() + " skipped, " + summary.todo() + " todo (" + summary.total() + " total, "
            + summary.elapsed().toMillis() + "ms)");
        out.flush();
    }
}
