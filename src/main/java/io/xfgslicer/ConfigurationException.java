package io.xfgslicer;

/**
 * A run cannot start because a required input or setting is missing or invalid.
 * Raised before any file is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
