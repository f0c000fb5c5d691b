package org.structura.runtime.api;

/**
 * Thrown when a step is applied out of order. The committed state is left unchanged.
 */
public class SequenceException extends Exception {

    /**
     * Creates a new SequenceException with the given message.
     *
     * @param message description of the problem.
     */
    public SequenceException(String message) {
        super(message);
    }
}
