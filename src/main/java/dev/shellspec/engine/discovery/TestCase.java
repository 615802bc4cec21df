package dev.shellspec.engine.discovery;

import java.util.Objects;

/**
 * One test function of a test file.
 */
public record TestCase(TestFile file, String name, int line, Directive directive) {
    public TestCase {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(name, "name");
        directive = directive == null ? Directive.NONE : directive;
    }

    public String description() {
        return name;
    }

    public String displayFile() {
        return file.displayPath();
    }
}
