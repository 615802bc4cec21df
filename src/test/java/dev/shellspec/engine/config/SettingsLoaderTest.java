package dev.shellspec.engine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.shellspec.engine.support.ShellTestSupport;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsLoaderTest {
    @Test
    void readsEverySection() {
        var settings = SettingsLoader.parse("""
            pattern = "*.spec.sh"
            prefix = "it_"
            shell = "/usr/local/bin/bash"
            timeout = "30s"

            [coverage]
            enabled = true
            threshold = 80
            targets = ["lib/util.sh", "lib/net.sh"]
            json = "coverage.json"
            include-tests = true

            [mocks]
            curl = "echo offline"

            [stubs]
            log_line = ":"
            """, Optional.empty());

        assertEquals(Optional.of("*.spec.sh"), settings.pattern());
        assertEquals(Optional.of("it_"), settings.prefix());
        assertEquals(Optional.of("/usr/local/bin/bash"), settings.shell());
        assertEquals(Optional.of(Duration.ofSeconds(30)), settings.timeout());
        assertEquals(Optional.of(true), settings.coverageEnabled());
        assertEquals(OptionalInt.of(80), settings.coverageThreshold());
        assertEquals(List.of(Path.of("lib/util.sh"), Path.of("lib/net.sh")), settings.coverageTargets());
        assertEquals(Optional.of(Path.of("coverage.json")), settings.coverageJson());
        assertEquals(Optional.of(true), settings.coverageIncludeTests());
        assertEquals(Map.of("curl", "echo offline"), settings.mocks());
        assertEquals(Map.of("log_line", ":"), settings.stubs());
    }

    @Test
    void missingKeysStayEmpty() {
        var settings = SettingsLoader.parse("prefix = \"check_\"\n", Optional.empty());
        assertEquals(Optional.of("check_"), settings.prefix());
        assertTrue(settings.pattern().isEmpty());
        assertTrue(settings.coverageThreshold().isEmpty());
        assertTrue(settings.mocks().isEmpty());
    }

    @Test
    void rejectsMalformedToml() {
        var ex = assertThrows(ConfigurationException.class, () -> SettingsLoader.parse("pattern = ", Optional.empty()));
        assertTrue(ex.getMessage().startsWith("Invalid <inline>"), ex.getMessage());
    }

    @Test
    void rejectsWrongTypes() {
        assertThrows(ConfigurationException.class, () -> SettingsLoader.parse("prefix = 3\n", Optional.empty()));
        assertThrows(ConfigurationException.class, () -> SettingsLoader.parse("[mocks]\ncurl = 1\n", Optional.empty()));
        assertThrows(ConfigurationException.class, () -> SettingsLoader.parse("timeout = \"soon\"\n", Optional.empty()));
    }

    @Test
    void locatesDefaultFileOnlyWhenPresent(@TempDir Path dir) {
        assertSame(ProjectSettings.EMPTY, SettingsLoader.locate(dir, Optional.empty()));

        Path file = ShellTestSupport.write(dir, SettingsLoader.DEFAULT_FILE, "pattern = \"*_spec.sh\"\n");
        var settings = SettingsLoader.locate(dir, Optional.empty());
        assertEquals(Optional.of("*_spec.sh"), settings.pattern());
        assertEquals(Optional.of(file), settings.source());
    }

    @Test
    void explicitFileMustExist(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> SettingsLoader.locate(dir, Optional.of(dir.resolve("nope.toml"))));
    }
}
