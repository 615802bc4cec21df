package dev.shellspec.engine.discovery;

import dev.shellspec.engine.substitution.ProcedureLookup;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A discovered test file together with what loading it declared.
 *
 * @param path absolute, normalized path
 * @param displayPath path relative to the discovery root, as shown in reports
 * @param lines source lines, used for directives
 * @param procedures every function visible after loading, in declaration order
 */
public record TestFile(Path path, String displayPath, List<String> lines, List<DeclaredProcedure> procedures)
    implements ProcedureLookup {

    public TestFile {
        lines = List.copyOf(lines);
        procedures = List.copyOf(procedures);
    }

    @Override
    public Optional<String> definitionOf(String name) {
        return procedures.stream()
            .filter(procedure -> procedure.name().equals(name))
            .map(DeclaredProcedure::definition)
            .findFirst();
    }

    public boolean declaredHere(DeclaredProcedure procedure) {
        return procedure.source().toAbsolutePath().normalize().equals(path);
    }
}
