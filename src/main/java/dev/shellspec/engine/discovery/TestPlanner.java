package dev.shellspec.engine.discovery;

import dev.shellspec.engine.config.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the ordered list of test cases under a root directory.
 */
public final class TestPlanner {
    private static final Logger log = LoggerFactory.getLogger(TestPlanner.class);
    private static final Pattern PREFIX = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final DeclarationLoader loader;

    public TestPlanner(DeclarationLoader loader) {
        this.loader = loader;
    }

    public static void validatePrefix(String prefix) {
        if (prefix == null || !PREFIX.matcher(prefix).matches()) {
            throw new ConfigurationException("Test prefix must be a shell identifier prefix: '" + prefix + "'");
        }
    }

    public ExecutionPlan plan(Path root, String glob, String prefix) {
        validatePrefix(prefix);
        Path base = root.toAbsolutePath().normalize();
        List<Path> files = TestFileFinder.find(base, glob);
        log.debug("Found {} test file(s) matching {} under {}", files.size(), glob, base);

        List<TestCase> cases = new ArrayList<>();
        List<DiscoveryFailure> failures = new ArrayList<>();
        for (Path path : files) {
            String display = base.relativize(path).toString();
            try {
                cases.addAll(casesOf(load(path, display), prefix));
            } catch (DiscoveryException ex) {
                log.warn("Skipping {}: {}", display, ex.getMessage());
                failures.add(new DiscoveryFailure(path, display, ex.getMessage()));
            }
        }
        return new ExecutionPlan(cases, failures, files);
    }

    TestFile load(Path path, String display) {
        List<String> lines;
        try {
            lines = new String(Files.readAllBytes(path), StandardCharsets.UTF_8).lines().toList();
        } catch (IOException ex) {
            throw new DiscoveryException(path, "unreadable: " + ex.getMessage());
        }
        return new TestFile(path, display, lines, loader.load(path));
    }

    static List<TestCase> casesOf(TestFile file, String prefix) {
        return file.procedures().stream()
            .filter(file::declaredHere)
            .filter(procedure -> procedure.name().startsWith(prefix))
            .sorted(Comparator.comparingInt(DeclaredProcedure::line))
            .map(procedure -> new TestCase(
                file,
                procedure.name(),
                procedure.line(),
                DirectiveParser.parse(file.lines(), procedure.line())
            ))
            .toList();
    }
}
