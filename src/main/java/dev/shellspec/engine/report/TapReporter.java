package dev.shellspec.engine.report;

import dev.shellspec.engine.discovery.DiscoveryFailure;
import dev.shellspec.engine.discovery.ExecutionPlan;
import dev.shellspec.engine.runtime.ExecutionResult;
import java.io.PrintStream;

/**
 * Emits TAP version 13. The plan line precedes every result; anything else is a {@code #} comment.
 */
public final class TapReporter implements RunListener {
    static final String VERSION = "TAP version 13";

    private final PrintStream out;
    private int expected;
    private int emitted;

    public TapReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void planned(ExecutionPlan plan) {
        out.println(VERSION);
        for (DiscoveryFailure failure : plan.failures()) {
            comment("Failed to load " + failure.displayPath() + ": " + failure.message());
        }
        if (plan.isEmpty()) {
            comment("No tests found.");
        }
        expected = plan.total();
        out.println("1.." + expected);
        out.flush();
    }

    @Override
    public void testFinished(int sequence, ExecutionResult result) {
        if (sequence != emitted + 1 || sequence > expected) {
            throw new IllegalStateException("TAP result " + sequence + " out of order (last " + emitted + ", plan 1.." + expected + ")");
        }
        emitted = sequence;
        TapEvent.from(sequence, result).lines().forEach(out::println);
        out.flush();
    }

    @Override
    public void note(String line) {
        comment(line);
    }

    @Override
    public void runFinished(RunSummary summary) {
        comment("tests " + summary.total() + ", pass " + summary.passed() + ", fail " + summary.failed()
            + ", skip " + summary.skipped() + ", todo " + summary.todo());
        out.flush();
    }

    @Override
    public void aborted(String message) {
        out.println("Bail out! " + AnsiText.strip(message).replace('\n', ' '));
        out.flush();
    }

    private void comment(String text) {
        for (String line : AnsiText.strip(text).split("\r?\n", -1)) {
            out.println(line.isEmpty() ? "#" : "# " + line);
        }
    }
}
