package dev.shellspec.engine.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Unpacks the embedded Bash runtime (assertions, substitution registry, trace hook) into a run workspace so
 * test shells can source it by absolute path.
 */
public final class RuntimeLibrary {
    public static final String ASSERTIONS = "assertions.sh";
    public static final String SUBSTITUTION = "substitution.sh";
    public static final String TRACE = "trace.sh";

    private static final String RESOURCE_ROOT = "/runtime/";
    private static final List<String> FILES = List.of(ASSERTIONS, SUBSTITUTION, TRACE);

    private final Path directory;

    private RuntimeLibrary(Path directory) {
        this.directory = directory;
    }

    public static RuntimeLibrary extract(RunWorkspace workspace) {
        Path target = workspace.runtimeDirectory();
        for (String file : FILES) {
            try (InputStream raw = RuntimeLibrary.class.getResourceAsStream(RESOURCE_ROOT + file)) {
                if (raw == null) {
                    throw new IllegalStateException("Embedded runtime file missing from resources (" + RESOURCE_ROOT + file + ")");
                }
                Files.copy(raw, target.resolve(file), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to extract runtime file " + file + ": " + ex.getMessage(), ex);
            }
        }
        return new RuntimeLibrary(target);
    }

    public Path directory() {
        return directory;
    }

    public Path file(String name) {
        return directory.resolve(name);
    }
}
