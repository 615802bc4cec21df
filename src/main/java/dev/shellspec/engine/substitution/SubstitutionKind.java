package dev.shellspec.engine.substitution;

/**
 * The two kinds of substitution; they differ in how they are restored.
 */
public enum SubstitutionKind {
    /** Intercepts an external program found on {@code PATH}. Restoring removes the interceptor. */
    COMMAND("mock_command", "Mocked commands"),
    /** Replaces a shell function. Restoring reinstates the saved original, if there was one. */
    PROCEDURE("stub_function", "Stubbed functions");

    private final String shellFunction;
    private final String label;

    SubstitutionKind(String shellFunction, String label) {
        this.shellFunction = shellFunction;
        this.label = label;
    }

    /**
     * Name of the runtime library function that installs this kind inside a test shell.
     */
    public String shellFunction() {
        return shellFunction;
    }

    public String label() {
        return label;
    }
}
