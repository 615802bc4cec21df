package dev.shellspec.engine.substitution;

import java.util.Objects;
import java.util.Optional;

/**
 * One active mock or stub.
 *
 * @param target name of the command or function being replaced
 * @param kind command mock or function stub
 * @param body replacement shell code, forwarded positional arguments included
 * @param savedOriginal verbatim definition captured before stubbing; always empty for command mocks
 */
public record SubstitutionEntry(String target, SubstitutionKind kind, String body, Optional<String> savedOriginal) {
    public SubstitutionEntry {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(savedOriginal, "savedOriginal");
        if (kind == SubstitutionKind.COMMAND && savedOriginal.isPresent()) {
            throw new IllegalArgumentException("Command mocks never save an original: " + target);
        }
    }

    public static SubstitutionEntry command(String target, String body) {
        return new SubstitutionEntry(target, SubstitutionKind.COMMAND, body, Optional.empty());
    }

    public static SubstitutionEntry procedure(String target, String body, Optional<String> savedOriginal) {
        return new SubstitutionEntry(target, SubstitutionKind.PROCEDURE, body, savedOriginal);
    }
}
