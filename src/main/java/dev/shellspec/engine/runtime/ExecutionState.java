package dev.shellspec.engine.runtime;

/**
 * Lifecycle of one test case. Everything but {@link #PENDING} and {@link #RUNNING} is terminal.
 */
public enum ExecutionState {
    PENDING(null, false),
    RUNNING(null, false),
    PASSED(TestStatus.PASS, true),
    FAILED(TestStatus.FAIL, false),
    SKIPPED(TestStatus.SKIP, true),
    /** A {@code TODO} test that failed, as expected. */
    EXPECTED_FAIL(TestStatus.TODO, true),
    /** A {@code TODO} test that passed anyway. */
    UNEXPECTED_PASS(TestStatus.PASS, true);

    private final TestStatus status;
    private final boolean countsAsPassing;

    ExecutionState(TestStatus status, boolean countsAsPassing) {
        this.status = status;
        this.countsAsPassing = countsAsPassing;
    }

    public boolean isTerminal() {
        return status != null;
    }

    public boolean countsAsPassing() {
        return countsAsPassing;
    }

    /**
     * Whether the TAP line reads {@code ok}. An expected failure stays {@code not ok} and carries the TODO
     * directive instead.
     */
    public boolean isOk() {
        return this == PASSED || this == SKIPPED || this == UNEXPECTED_PASS;
    }

    public TestStatus status() {
        if (status == null) {
            throw new IllegalStateException("No status for non-terminal state " + this);
        }
        return status;
    }
}
