package dev.shellspec.engine.runtime;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * What the configured shell can do. Coverage needs a DEBUG trap that functions inherit ({@code set -T}),
 * which is reliable from Bash 4 on.
 *
 * @param builtins names {@code compgen -b} lists; a mock can never shadow these inside a test shell
 */
public record ShellCapabilities(String shell, boolean available, OptionalInt majorVersion, Set<String> builtins) {
    public static final int MINIMUM_TRACING_VERSION = 4;

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    public ShellCapabilities {
        builtins = Set.copyOf(builtins);
    }

    public static ShellCapabilities probe(String shell) {
        try {
            var outcome = new ShellProcess(shell).run(
                List.of("-c", "printf '%s\\n' \"${BASH_VERSINFO[0]}\"; compgen -b 2>/dev/null || true"),
                Path.of("").toAbsolutePath(),
                Optional.of(PROBE_TIMEOUT)
            );
            if (!outcome.succeeded()) {
                return unavailable(shell);
            }
            List<String> lines = outcome.output().lines().map(String::strip).filter(line -> !line.isEmpty()).toList();
            if (lines.isEmpty()) {
                return new ShellCapabilities(shell, true, OptionalInt.empty(), Set.of());
            }
            Set<String> builtins = Set.copyOf(lines.subList(1, lines.size()));
            try {
                return new ShellCapabilities(shell, true, OptionalInt.of(Integer.parseInt(lines.get(0))), builtins);
            } catch (NumberFormatException ex) {
                return new ShellCapabilities(shell, true, OptionalInt.empty(), builtins);
            }
        } catch (UncheckedIOException ex) {
            return unavailable(shell);
        }
    }

    private static ShellCapabilities unavailable(String shell) {
        return new ShellCapabilities(shell, false, OptionalInt.empty(), Set.of());
    }

    public boolean isBuiltin(String name) {
        return builtins.contains(name);
    }

    public boolean supportsTracing() {
        return available && majorVersion.orElse(0) >= MINIMUM_TRACING_VERSION;
    }

    public String describe() {
        if (!available) {
            return shell + " (not runnable)";
        }
        return shell + majorVersion.stream().mapToObj(v -> " (major version " + v + ")").findFirst().orElse(" (unknown version)");
    }
}
