package dev.shellspec.engine.runtime;

import dev.shellspec.engine.discovery.TestCase;
import java.util.Objects;

/**
 * Guards the state transitions of one test case. Once terminal, the state never changes.
 */
public final class TestExecution {
    private final TestCase testCase;
    private ExecutionState state = ExecutionState.PENDING;

    public TestExecution(TestCase testCase) {
        this.testCase = Objects.requireNonNull(testCase, "testCase");
    }

    public TestCase testCase() {
        return testCase;
    }

    public ExecutionState state() {
        return state;
    }

    public ExecutionState skip() {
        require(ExecutionState.PENDING, "skip");
        state = ExecutionState.SKIPPED;
        return state;
    }

    public ExecutionState start() {
        require(ExecutionState.PENDING, "start");
        state = ExecutionState.RUNNING;
        return state;
    }

    /**
     * Records the completion signal, remapped when the case carries a TODO directive.
     */
    public ExecutionState complete(boolean succeeded) {
        require(ExecutionState.RUNNING, "complete");
        if (testCase.directive().isTodo()) {
            state = succeeded ? ExecutionState.UNEXPECTED_PASS : ExecutionState.EXPECTED_FAIL;
        } else {
            state = succeeded ? ExecutionState.PASSED : ExecutionState.FAILED;
        }
        return state;
    }

    private void require(ExecutionState expected, String transition) {
        if (state != expected) {
            throw new IllegalStateException(
                "Cannot " + transition + " " + testCase.name() + " in state " + state + " (expected " + expected + ")"
            );
        }
    }
}
