package dev.shellspec.engine.discovery;

import java.util.Objects;

/**
 * Annotation attached to a test by a {@code # @SKIP reason} or {@code # @TODO reason} comment on the line
 * right above its declaration.
 */
public record Directive(Kind kind, String reason) {
    public static final Directive NONE = new Directive(Kind.NONE, "");

    public Directive {
        Objects.requireNonNull(kind, "kind");
        reason = reason == null ? "" : reason.strip();
    }

    public static Directive skip(String reason) {
        return new Directive(Kind.SKIP, reason);
    }

    public static Directive todo(String reason) {
        return new Directive(Kind.TODO, reason);
    }

    public boolean isSkip() {
        return kind == Kind.SKIP;
    }

    public boolean isTodo() {
        return kind == Kind.TODO;
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }

    /**
     * TAP directive text, e.g. {@code SKIP no database} or a bare {@code TODO}; empty for {@link #NONE}.
     */
    public String tapText() {
        if (kind == Kind.NONE) {
            return "";
        }
        return reason.isEmpty() ? kind.name() : kind.name() + " " + reason;
    }

    public enum Kind {
        NONE,
        SKIP,
        TODO
    }
}
