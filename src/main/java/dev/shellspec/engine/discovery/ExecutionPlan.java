package dev.shellspec.engine.discovery;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered test cases: files sorted by relative path, then declaration order inside each file. The order
 * is stable across runs, so sequence numbers can be correlated positionally.
 */
public record ExecutionPlan(List<TestCase> cases, List<DiscoveryFailure> failures, List<Path> files) {
    public ExecutionPlan {
        cases = List.copyOf(cases);
        failures = List.copyOf(failures);
        files = List.copyOf(files);
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of(), List.of(), List.of());
    }

    /**
     * Number of files matching the pattern, loadable or not.
     */
    public int fileCount() {
        return files.size();
    }

    public int total() {
        return cases.size();
    }

    public boolean isEmpty() {
        return cases.isEmpty();
    }
}
