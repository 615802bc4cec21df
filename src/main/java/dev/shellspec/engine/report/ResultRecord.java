package dev.shellspec.engine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.shellspec.engine.runtime.ExecutionResult;
import dev.shellspec.engine.runtime.ExecutionState;
import dev.shellspec.engine.runtime.TestStatus;

/**
 * One entry of the result stream.
 */
@JsonPropertyOrder({"file", "test", "status", "message", "duration_ms"})
public record ResultRecord(
    @JsonProperty("file") String file,
    @JsonProperty("test") String test,
    @JsonProperty("status") TestStatus status,
    @JsonProperty("message") String message,
    @JsonProperty("duration_ms") long durationMillis
) {
    public static ResultRecord from(ExecutionResult result) {
        String message = switch (result.state()) {
            case FAILED, EXPECTED_FAIL -> AnsiText.strip(result.output()).strip();
            case SKIPPED -> result.testCase().directive().reason();
            default -> "";
        };
        return new ResultRecord(
            result.testCase().displayFile(),
            result.testCase().name(),
            result.status(),
            message,
            result.state() == ExecutionState.SKIPPED ? 0 : result.durationMillis()
        );
    }
}
