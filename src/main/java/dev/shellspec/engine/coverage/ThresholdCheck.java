package dev.shellspec.engine.coverage;

import java.util.Optional;

/**
 * Minimum aggregate coverage a run must reach.
 */
public record ThresholdCheck(int minimum) {
    public ThresholdCheck {
        if (minimum < 0 || minimum > 100) {
            throw new IllegalArgumentException("Coverage threshold must be between 0 and 100: " + minimum);
        }
    }

    /**
     * @return the failure message, or empty when the report meets the threshold
     */
    public Optional<String> evaluate(CoverageReport report) {
        long actual = report.roundedPercent();
        if (actual < minimum) {
            return Optional.of("Coverage " + actual + "% is below threshold " + minimum + "%");
        }
        return Optional.empty();
    }
}
