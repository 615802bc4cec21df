package dev.shellspec.engine.shared;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Single-quote escaping for values spliced into generated Bash scripts.
 */
public final class ShellQuoting {
    private ShellQuoting() {}

    public static String quote(String value) {
        if (value == null || value.isEmpty()) {
            return "''";
        }
        return "'" + value.replace("'", "'\\''") + "'";
    }

    public static String quoteAll(Collection<String> values) {
        return values.stream().map(ShellQuoting::quote).collect(Collectors.joining(" "));
    }
}
