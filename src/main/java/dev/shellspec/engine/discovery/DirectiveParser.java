package dev.shellspec.engine.discovery;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the directive comment immediately preceding a function declaration.
 */
public final class DirectiveParser {
    private static final Pattern DIRECTIVE = Pattern.compile("^\\s*#\\s*@(SKIP|TODO)(?:\\s+(.*))?\\s*$");

    private DirectiveParser() {}

    /**
     * @param lines source lines of the file
     * @param declarationLine 1-based line of the declaration
     */
    public static Directive parse(List<String> lines, int declarationLine) {
        int previous = declarationLine - 1;
        if (previous < 1 || previous > lines.size()) {
            return Directive.NONE;
        }
        return parseComment(lines.get(previous - 1));
    }

    public static Directive parseComment(String line) {
        if (line == null) {
            return Directive.NONE;
        }
        Matcher matcher = DIRECTIVE.matcher(line);
        if (!matcher.matches()) {
            return Directive.NONE;
        }
        String reason = matcher.group(2) == null ? "" : matcher.group(2);
        return "SKIP".equals(matcher.group(1)) ? Directive.skip(reason) : Directive.todo(reason);
    }
}
