package dev.shellspec.engine.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.shellspec.engine.discovery.Directive;
import dev.shellspec.engine.discovery.ExecutionPlan;
import dev.shellspec.engine.runtime.ExecutionResult;
import dev.shellspec.engine.runtime.ExecutionState;
import dev.shellspec.engine.support.ShellTestSupport;
import dev.shellspec.engine.support.ShellTestSupport.CapturedOutput;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ConsoleReporterTest {
    @Test
    void printsPlanResultsAndTotals() {
        var ok = ShellTestSupport.syntheticCase("test_ok", Directive.NONE);
        var bad = ShellTestSupport.syntheticCase("test_bad", Directive.NONE);
        var skip = ShellTestSupport.syntheticCase("test_skip", Directive.skip("slow"));
        var captured = new CapturedOutput();
        var reporter = new ConsoleReporter(captured.stream(), false);

        reporter.planned(new ExecutionPlan(List.of(ok, bad, skip), List.of(), List.of()));
        reporter.testFinished(1, new ExecutionResult(ok, ExecutionState.PASSED, "noise", OptionalInt.of(0), Duration.ofMillis(12), false));
        reporter.testFinished(2, new ExecutionResult(bad, ExecutionState.FAILED, "FAIL: assert_equals\n", OptionalInt.of(1), Duration.ofMillis(5), false));
        reporter.testFinished(3, ExecutionResult.skipped(skip));
        reporter.runFinished(new RunSummary(3, 2, 1, 1, 0, 0, Duration.ofMillis(40)));

        assertEquals(List.of(
            "Found 3 tests.",
            "PASS: test_ok (12ms)",
            "FAIL: test_bad (5ms)",
            "    FAIL: assert_equals",
            "SKIP: test_skip (slow)",
            "",
            "Results: 2 passed, 1 failed, 1 skipped, 0 todo (3 total, 40ms)"
        ), captured.lines());
    }

    @Test
    void verboseShowsPassingOutput() {
        var ok = ShellTestSupport.syntheticCase("test_ok", Directive.NONE);
        var captured = new CapturedOutput();
        new ConsoleReporter(captured.stream(), true)
            .testFinished(1, new ExecutionResult(ok, ExecutionState.PASSED, "details\n", OptionalInt.of(0), Duration.ofMillis(1), false));
        assertEquals(List.of("PASS: test_ok (1ms)", "    details"), captured.lines());
    }

    @Test
    void emptyPlanSaysNoTestsFound() {
        var captured = new CapturedOutput();
        new ConsoleReporter(captured.stream(), false).planned(ExecutionPlan.empty());
        assertTrue(captured.text().contains("No tests found."));
    }
}
