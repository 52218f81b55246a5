package io.fnanalyzer.cli.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, malformed environment
 * values or settings out of range. The message is suitable for command-line error output.
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
