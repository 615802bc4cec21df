package dev.shellspec.engine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.shellspec.engine.config.ConfigurationException;
import dev.shellspec.engine.config.SettingsLoader;
import dev.shellspec.engine.support.ShellTestSupport;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunConfigurationTest {
    @Test
    void defaultsFollowTheNamingConvention() {
        var configuration = RunConfiguration.builder().build();
        assertEquals("*_test.sh", configuration.pattern());
        assertEquals("test_", configuration.prefix());
        assertEquals("bash", configuration.shell());
        assertTrue(configuration.timeout().isEmpty());
        assertFalse(configuration.coverageRequested());
        assertTrue(configuration.root().isAbsolute());
    }

    @Test
    void laterValuesOverrideSettings(@TempDir Path dir) {
        var settings = SettingsLoader.load(ShellTestSupport.write(dir, SettingsLoader.DEFAULT_FILE, """
            pattern = "*.spec.sh"
            prefix = "it_"
            [coverage]
            threshold = 70
            [mocks]
            curl = "echo offline"
            """));

        var configuration = RunConfiguration.builder()
            .settings(settings)
            .prefix("check_")
            .build();

        assertEquals("*.spec.sh", configuration.pattern());
        assertEquals("check_", configuration.prefix());
        assertEquals(OptionalInt.of(70), configuration.coverageThreshold());
        assertTrue(configuration.coverageRequested());
        assertEquals(Map.of("curl", "echo offline"), configuration.mocks());
    }

    @Test
    void coverageIsImpliedByTargetsOrReport() {
        assertTrue(RunConfiguration.builder().coverageTarget(Path.of("lib.sh")).build().coverageRequested());
        assertTrue(RunConfiguration.builder().coverageJson(Path.of("c.json")).build().coverageRequested());
        assertEquals(List.of(Path.of("lib.sh")), RunConfiguration.builder().coverageTarget(Path.of("lib.sh")).build().coverageTargets());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(ConfigurationException.class, () -> RunConfiguration.builder().prefix("test-").build());
        assertThrows(ConfigurationException.class, () -> RunConfiguration.builder().pattern("").build());
        assertThrows(ConfigurationException.class, () -> RunConfiguration.builder().pattern("dir/*_test.sh").build());
        assertThrows(ConfigurationException.class, () -> RunConfiguration.builder().coverageThreshold(101).build());
        assertThrows(ConfigurationException.class, () -> RunConfiguration.builder().shell(" ").build());
    }

    @Test
    void logLevelsParseCaseInsensitively() {
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("verbose"));
    }
}
