package org.structura.runtime.api;

/**
 * Thrown when an initial structure configuration is malformed. Initialization is aborted.
 */
public class ConfigurationException extends Exception {

    /**
     * Creates a new ConfigurationException with the given message.
     *
     * @param message description of the problem.
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a new ConfigurationException with the given message and cause.
     *
     * @param message description of the problem.
     * @param cause the underlying failure.
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
