package dev.shellspec.engine.config;

import dev.shellspec.engine.shared.DurationParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@code shellspec.toml}.
 */
public final class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String DEFAULT_FILE = "shellspec.toml";

    private SettingsLoader() {}

    /**
     * Loads the explicit file when given (it must exist), otherwise {@code shellspec.toml} in the root when
     * present, otherwise nothing.
     */
    public static ProjectSettings locate(Path root, Optional<Path> explicit) {
        if (explicit.isPresent()) {
            Path file = explicit.get();
            if (!Files.isRegularFile(file)) {
                throw new ConfigurationException("Config file not found: " + file);
            }
            return load(file);
        }
        Path candidate = root.resolve(DEFAULT_FILE);
        if (Files.isRegularFile(candidate)) {
            return load(candidate);
        }
        log.debug("No {} in {}", DEFAULT_FILE, root);
        return ProjectSettings.EMPTY;
    }

    public static ProjectSettings load(Path file) {
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read " + file + ": " + ex.getMessage(), ex);
        }
        return parse(text, Optional.of(file));
    }

    static ProjectSettings parse(String text, Optional<Path> source) {
        String origin = source.map(Path::toString).orElse("<inline>");
        TomlParseResult toml = Toml.parse(text);
        if (toml.hasErrors()) {
            String errors = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid " + origin + ": " + errors);
        }
        try {
            TomlTable coverage = toml.getTable("coverage");
            Optional<Duration> timeout = Optional.ofNullable(toml.getString("timeout")).flatMap(raw -> parseDuration(raw, origin));
            return new ProjectSettings(
                source,
                Optional.ofNullable(toml.getString("pattern")),
                Optional.ofNullable(toml.getString("prefix")),
                Optional.ofNullable(toml.getString("shell")),
                timeout,
                Optional.ofNullable(coverage == null ? null : coverage.getBoolean("enabled")),
                threshold(coverage),
                targets(coverage),
                Optional.ofNullable(coverage == null ? null : coverage.getString("json")).map(Path::of),
                Optional.ofNullable(coverage == null ? null : coverage.getBoolean(List.of("include-tests"))),
                stringTable(toml.getTable("mocks"), origin, "mocks"),
                stringTable(toml.getTable("stubs"), origin, "stubs")
            );
        } catch (TomlInvalidTypeException ex) {
            throw new ConfigurationException("Invalid " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<Duration> parseDuration(String raw, String origin) {
        try {
            return DurationParser.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Invalid timeout in " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static OptionalInt threshold(TomlTable coverage) {
        if (coverage == null) {
            return OptionalInt.empty();
        }
        Long value = coverage.getLong("threshold");
        return value == null ? OptionalInt.empty() : OptionalInt.of(Math.toIntExact(value));
    }

    private static List<Path> targets(TomlTable coverage) {
        if (coverage == null) {
            return List.of();
        }
        TomlArray array = coverage.getArray("targets");
        if (array == null) {
            return List.of();
        }
        List<Path> targets = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            targets.add(Path.of(array.getString(i)));
        }
        return targets;
    }

    private static Map<String, String> stringTable(TomlTable table, String origin, String name) {
        if (table == null || table.isEmpty()) {
            return Map.of();
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (String key : new TreeSet<>(table.keySet())) {
            String value = table.getString(List.of(key));
            if (value == null) {
                throw new ConfigurationException("Invalid " + origin + ": [" + name + "] entry '" + key + "' must be a string");
            }
            entries.put(key, value);
        }
        return entries;
    }
}
