package dev.shellspec.engine.config;

/**
 * Invalid settings: unreadable config file, bad glob or prefix, unparsable duration, negative threshold.
 */
public final class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
