package io.quantum.core.config;

/**
 * Thrown when runtime configuration cannot be loaded: missing file, invalid YAML, an unknown key
 * or a value out of range. The message is suitable for startup error output.
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
