package dev.shellspec.engine.runtime;

import java.time.Duration;

/**
 * What a finished shell process left behind: merged stdout/stderr, exit status and wall time.
 */
public record ProcessOutcome(String output, int exitCode, Duration elapsed, boolean timedOut) {
    public static final int TIMEOUT_EXIT_CODE = 124;

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
