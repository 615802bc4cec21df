package dev.shellspec.engine.coverage;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a source line can ever be reported by the trace hook.
 */
public final class LineClassifier {
    private static final Pattern FUNCTION_DECLARATION = Pattern.compile(
        "^(?:[a-zA-Z_][a-zA-Z0-9_]*\\s*\\(\\)\\s*\\{?"
            + "|function\\s+[a-zA-Z_][a-zA-Z0-9_]*\\s*\\{?"
            + "|function\\s+[a-zA-Z_][a-zA-Z0-9_]*\\s*\\(\\)\\s*\\{?)$"
    );
    private static final Set<String> STRUCTURAL = Set.of("{", "}", "fi", "done", "esac", "then", "else", "do");

    private LineClassifier() {}

    public static boolean isExecutable(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return false;
        }
        if (STRUCTURAL.contains(trimmed)) {
            return false;
        }
        return !FUNCTION_DECLARATION.matcher(trimmed).matches();
    }
}
