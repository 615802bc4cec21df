package dev.shellspec.engine.api;

import java.util.Locale;

/**
 * Engine log thresholds, mapped onto the SLF4J simple binding.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Sets the default level of the simple binding. Only loggers created afterwards see it, so the CLI
     * calls this before anything else touches SLF4J.
     */
    public void install() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, name().toLowerCase(Locale.ROOT));
    }
}
