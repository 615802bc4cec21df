package dev.shellspec.engine.runtime;

import dev.shellspec.engine.discovery.TestCase;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable outcome of one test case.
 *
 * @param exitCode completion status of the test shell; empty when no shell was launched
 */
public record ExecutionResult(
    TestCase testCase,
    ExecutionState state,
    String output,
    OptionalInt exitCode,
    Duration duration,
    boolean timedOut
) {
    public ExecutionResult {
        Objects.requireNonNull(testCase, "testCase");
        Objects.requireNonNull(state, "state");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Result requires a terminal state, got " + state);
        }
        output = output == null ? "" : output;
        exitCode = exitCode == null ? OptionalInt.empty() : exitCode;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static ExecutionResult skipped(TestCase testCase) {
        return new ExecutionResult(testCase, ExecutionState.SKIPPED, "", OptionalInt.empty(), Duration.ZERO, false);
    }

    public TestStatus status() {
        return state.status();
    }

    public boolean countsAsPassing() {
        return state.countsAsPassing();
    }

    public long durationMillis() {
        return duration.toMillis();
    }
}
