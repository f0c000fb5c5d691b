package org.structura.runtime.api;

/**
 * Thrown when an execution plan is malformed. Initialization is aborted.
 */
public class SchemaException extends Exception {

    /**
     * Creates a new SchemaException with the given message.
     *
     * @param message description of the problem.
     */
    public SchemaException(String message) {
        super(message);
    }

    /**
     * Creates a new SchemaException with the given message and cause.
     *
     * @param message description of the problem.
     * @param cause the underlying failure.
     */
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
