package dev.shellspec.engine.report;

import dev.shellspec.engine.discovery.ExecutionPlan;
import dev.shellspec.engine.runtime.ExecutionResult;

/**
 * Receives run events in order: the plan, one result per case in plan order, free-form notes, the summary.
 */
public interface RunListener {
    default void planned(ExecutionPlan plan) {}

    /**
     * @param sequence 1-based position of the case in the plan
     */
    default void testFinished(int sequence, ExecutionResult result) {}

    /**
     * Human-readable line outside of the result grammar, such as a coverage summary.
     */
    default void note(String line) {}

    default void runFinished(RunSummary summary) {}

    /**
     * The engine itself failed and no further events follow.
     */
    default void aborted(String message) {}
}
