package dev.shellspec.engine.discovery;

import dev.shellspec.engine.runtime.ProcessOutcome;
import dev.shellspec.engine.runtime.ShellProcess;
import dev.shellspec.engine.shared.DurationParser;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a test file into a throwaway shell and reports the functions it declared, without calling any.
 *
 * <p>The loader syntax-checks first, then sources the file with stdout discarded and stdin from
 * {@code /dev/null}. A marker line separates whatever loading printed on stderr from the declaration
 * dump, so a file that exits while being sourced is detected by the missing marker.
 */
public final class DeclarationLoader {
    private static final Logger log = LoggerFactory.getLogger(DeclarationLoader.class);

    static final String MARKER = "__SHELLSPEC_DECLARATIONS__";
    static final char RECORD_SEPARATOR = '\u001e';

    static final String LOADER_SCRIPT = String.join("\n",
        "__shellspec_file=\"$1\"",
        "if ! __shellspec_syntax=\"$(\"$BASH\" -n \"$__shellspec_file\" 2>&1)\"; then",
        "    printf '%s\\n' \"$__shellspec_syntax\"",
        "    exit 2",
        "fi",
        "source \"$__shellspec_file\" 2>&1 >/dev/null </dev/null",
        "printf '\\n%s\\n' '" + MARKER + "'",
        "shopt -s extdebug",
        "while read -r _ _ __shellspec_name; do",
        "    printf '\\036%s\\n' \"$(declare -F \"$__shellspec_name\")\"",
        "    declare -f \"$__shellspec_name\"",
        "done < <(declare -F)",
        "exit 0",
        "");

    private final ShellProcess shell;
    private final Optional<Duration> timeout;

    public DeclarationLoader(ShellProcess shell, Optional<Duration> timeout) {
        this.shell = shell;
        this.timeout = timeout;
    }

    public List<DeclaredProcedure> load(Path file) {
        Path directory = file.getParent() == null ? Path.of("").toAbsolutePath() : file.getParent();
        ProcessOutcome outcome = shell.run(List.of("-c", LOADER_SCRIPT, "shellspec-loader", file.toString()), directory, timeout);
        if (outcome.timedOut()) {
            throw new DiscoveryException(file, "loading did not finish within " + timeout.map(DurationParser::format).orElse("the timeout"));
        }
        String output = outcome.output();
        int marker = output.indexOf("\n" + MARKER + "\n");
        if (marker < 0) {
            String diagnostic = output.strip();
            if (outcome.exitCode() == 2 && !diagnostic.isEmpty()) {
                throw new DiscoveryException(file, "syntax error: " + diagnostic);
            }
            throw new DiscoveryException(file, diagnostic.isEmpty()
                ? "exited with status " + outcome.exitCode() + " while loading"
                : "exited with status " + outcome.exitCode() + " while loading: " + diagnostic);
        }
        String chatter = output.substring(0, marker).strip();
        if (!chatter.isEmpty()) {
            log.debug("Loading {} printed: {}", file, chatter);
        }
        return parse(output.substring(marker + MARKER.length() + 2));
    }

    /**
     * Parses the declaration dump: records of {@code name line file} followed by the definition text.
     */
    static List<DeclaredProcedure> parse(String dump) {
        List<DeclaredProcedure> procedures = new ArrayList<>();
        for (String record : dump.split(String.valueOf(RECORD_SEPARATOR))) {
            if (record.isBlank()) {
                continue;
            }
            int newline = record.indexOf('\n');
            String header = newline < 0 ? record : record.substring(0, newline);
            String definition = newline < 0 ? "" : record.substring(newline + 1).stripTrailing();
            String[] parts = header.split(" ", 3);
            if (parts.length < 3) {
                log.debug("Ignoring malformed declaration header '{}'", header);
                continue;
            }
            int line;
            try {
                line = Integer.parseInt(parts[1]);
            } catch (NumberFormatException ex) {
                log.debug("Ignoring declaration with unreadable line '{}'", header);
                continue;
            }
            procedures.add(new DeclaredProcedure(parts[0], line, Path.of(parts[2]).toAbsolutePath().normalize(), definition));
        }
        return procedures;
    }
}
