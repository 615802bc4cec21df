package dev.shellspec.engine.report;

import dev.shellspec.engine.discovery.Directive;
import dev.shellspec.engine.runtime.ExecutionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One TAP result line and, for plain failures, its YAML diagnostic block.
 */
public record TapEvent(int number, boolean ok, String description, Directive directive, Optional<Diagnostic> diagnostic) {
    public TapEvent {
        if (number < 1) {
            throw new IllegalArgumentException("TAP test numbers start at 1: " + number);
        }
        directive = directive == null ? Directive.NONE : directive;
        diagnostic = diagnostic == null ? Optional.empty() : diagnostic;
    }

    public static TapEvent from(int number, ExecutionResult result) {
        boolean ok = result.state().isOk();
        Directive directive = result.testCase().directive();
        Optional<Diagnostic> diagnostic = Optional.empty();
        if (!ok && !directive.isPresent()) {
            diagnostic = Optional.of(new Diagnostic(
                failureMessage(result),
                result.testCase().displayFile(),
                result.testCase().name(),
                result.durationMillis()
            ));
        }
        return new TapEvent(number, ok, result.testCase().description(), directive, diagnostic);
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        var line = new StringBuilder(ok ? "ok " : "not ok ").append(number).append(" - ").append(description);
        if (directive.isPresent()) {
            line.append(" # ").append(directive.tapText());
        }
        lines.add(line.toString());
        diagnostic.ifPresent(block -> lines.addAll(block.lines()));
        return lines;
    }

    static String failureMessage(ExecutionResult result) {
        String output = AnsiText.strip(result.output()).strip();
        if (!output.isEmpty()) {
            return output;
        }
        return result.exitCode().isPresent()
            ? "test exited with status " + result.exitCode().getAsInt()
            : "test failed";
    }

    /**
     * YAML block following a {@code not ok} line.
     */
    public record Diagnostic(String message, String file, String function, long durationMillis) {
        public List<String> lines() {
            List<String> lines = new ArrayList<>();
            lines.add("  ---");
            lines.add("  message: " + quoted(message));
            lines.add("  severity: fail");
            lines.add("  file: " + quoted(file));
            lines.add("  function: " + quoted(function));
            lines.add("  duration_ms: " + durationMillis);
            lines.add("  ...");
            return lines;
        }

        static String quoted(String value) {
            String escaped = AnsiText.strip(value).replace("'", "''");
            String[] parts = escaped.split("\r?\n", -1);
            return "'" + String.join("\n    ", parts) + "'";
        }
    }
}
