package io.rulekit.core.config;

/**
 * Thrown when validator configuration cannot be loaded: missing file, invalid
 * YAML, or a value of the wrong kind. The message names the offending file or
 * key.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
