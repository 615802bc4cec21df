package dev.shellspec.engine.discovery;

import java.nio.file.Path;

/**
 * A function found while loading a test file.
 *
 * @param name function name
 * @param line line of the declaration in {@code source}
 * @param source file the function was declared in (a test file may source helpers)
 * @param definition verbatim {@code declare -f} text
 */
public record DeclaredProcedure(String name, int line, Path source, String definition) {}
