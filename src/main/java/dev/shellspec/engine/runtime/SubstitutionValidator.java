package dev.shellspec.engine.runtime;

import dev.shellspec.engine.substitution.SubstitutionEntry;
import dev.shellspec.engine.substitution.SubstitutionException;
import dev.shellspec.engine.substitution.SubstitutionKind;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the checks the shell runtime makes at install time, ahead of the run: mocks may not shadow a
 * builtin of the configured shell, and every body must parse as a function.
 */
public final class SubstitutionValidator {
    private static final Logger log = LoggerFactory.getLogger(SubstitutionValidator.class);
    private static final Duration PARSE_TIMEOUT = Duration.ofSeconds(10);

    private final ShellProcess shell;
    private final ShellCapabilities capabilities;
    private final Path workingDirectory;

    public SubstitutionValidator(ShellProcess shell, ShellCapabilities capabilities, Path workingDirectory) {
        this.shell = shell;
        this.capabilities = capabilities;
        this.workingDirectory = workingDirectory;
    }

    /**
     * @throws SubstitutionException when a test shell would refuse to install the entry
     */
    public void validate(SubstitutionEntry entry) {
        String operation = entry.kind().shellFunction();
        if (entry.kind() == SubstitutionKind.COMMAND && capabilities.isBuiltin(entry.target())) {
            throw new SubstitutionException(SubstitutionException.Reason.FORBIDDEN_TARGET, entry.kind(), operation, entry.target());
        }
        String definition = entry.target() + "() { " + entry.body() + "\n}\n";
        ProcessOutcome outcome = shell.run(List.of("-n", "-c", definition), workingDirectory, Optional.of(PARSE_TIMEOUT));
        if (!outcome.succeeded()) {
            log.debug("{} {} does not parse: {}", operation, entry.target(), outcome.output().strip());
            throw new SubstitutionException(SubstitutionException.Reason.INVALID_BODY, entry.kind(), operation, entry.target());
        }
    }
}
