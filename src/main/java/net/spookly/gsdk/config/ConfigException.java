package net.spookly.gsdk.config;

/**
 * Raised when the agent configuration is missing required values or cannot be read.
 */
public class ConfigException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
