package dev.shellspec.engine.substitution;

import dev.shellspec.engine.shared.ShellQuoting;
import java.util.List;

/**
 * Renders registry contents as calls into the runtime library, so the shell-side registry tracks them
 * and {@code unmock_all} restores them along with whatever the test itself registered.
 */
public final class SubstitutionScript {
    private SubstitutionScript() {}

    public static String install(List<SubstitutionEntry> entries) {
        var script = new StringBuilder();
        for (SubstitutionEntry entry : entries) {
            script.append(entry.kind().shellFunction())
                .append(' ')
                .append(ShellQuoting.quote(entry.target()))
                .append(' ')
                .append(ShellQuoting.quote(entry.body()))
                .append(" || exit 1\n");
        }
        return script.toString();
    }

    public static String forbiddenCommandsArray(String variable) {
        return variable + "=(" + ShellQuoting.quoteAll(SubstitutionRegistry.FORBIDDEN_COMMANDS) + ")\n";
    }
}
