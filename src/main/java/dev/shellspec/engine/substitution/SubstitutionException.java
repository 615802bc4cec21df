package dev.shellspec.engine.substitution;

/**
 * Rejected registration or removal request. The registry is left exactly as it was.
 * Messages match the ones the shell runtime prints for the same mistake.
 */
public final class SubstitutionException extends RuntimeException {
    private final Reason reason;
    private final SubstitutionKind kind;
    private final String target;

    public SubstitutionException(Reason reason, SubstitutionKind kind, String operation, String target) {
        super(operation + ": " + reason.describe(kind, target));
        this.reason = reason;
        this.kind = kind;
        this.target = target;
    }

    public Reason reason() {
        return reason;
    }

    public SubstitutionKind kind() {
        return kind;
    }

    public String target() {
        return target;
    }

    public enum Reason {
        MISSING_NAME,
        MISSING_BODY,
        FORBIDDEN_TARGET,
        ALREADY_MOCKED,
        ALREADY_STUBBED,
        NOT_MOCKED,
        NOT_STUBBED,
        INVALID_BODY,
        CONFLICTING_TARGET;

        String describe(SubstitutionKind kind, String target) {
            return switch (this) {
                case MISSING_NAME -> (kind == SubstitutionKind.COMMAND ? "command" : "function") + " name required";
                case MISSING_BODY -> "implementation required";
                case FORBIDDEN_TARGET -> "cannot mock shell builtin '" + target + "'";
                case ALREADY_MOCKED -> "'" + target + "' is already mocked (call unmock_command first)";
                case ALREADY_STUBBED -> "'" + target + "' is already stubbed (call unstub_function first)";
                case NOT_MOCKED -> "'" + target + "' is not mocked";
                case NOT_STUBBED -> "'" + target + "' is not stubbed";
                case INVALID_BODY -> "invalid implementation for '" + target + "'";
                case CONFLICTING_TARGET -> "'" + target + "' is already substituted";
            };
        }
    }
}
