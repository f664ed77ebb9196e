package io.octave.core.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or a value of the wrong
 * shape. The message names the offending key or file.
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
