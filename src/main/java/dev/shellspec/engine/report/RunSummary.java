package dev.shellspec.engine.report;

import dev.shellspec.engine.runtime.ExecutionResult;
import dev.shellspec.engine.runtime.ExecutionState;
import java.time.Duration;
import java.util.List;

/**
 * Totals for a finished run. Skipped and TODO cases count as passing.
 */
public record RunSummary(int total, int passed, int failed, int skipped, int todo, int discoveryFailures, Duration elapsed) {
    public static RunSummary of(List<ExecutionResult> results, int discoveryFailures, Duration elapsed) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int todo = 0;
        for (ExecutionResult result : results) {
            if (result.countsAsPassing()) {
                passed++;
            } else {
                failed++;
            }
            if (result.state() == ExecutionState.SKIPPED) {
                skipped++;
            }
            if (result.testCase().directive().isTodo()) {
                todo++;
            }
        }
        return new RunSummary(results.size(), passed, failed, skipped, todo, discoveryFailures, elapsed);
    }

    public boolean successful() {
        return failed == 0;
    }
}
