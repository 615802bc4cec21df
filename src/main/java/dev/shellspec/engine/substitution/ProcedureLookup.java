package dev.shellspec.engine.substitution;

import java.util.Optional;

/**
 * Source of the statically declared function definitions a stub may shadow.
 */
@FunctionalInterface
public interface ProcedureLookup {
    ProcedureLookup NONE = name -> Optional.empty();

    Optional<String> definitionOf(String name);
}
