package org.structura.runtime.api;

/**
 * Thrown when a history index lies outside the committed history.
 */
public class NavigationException extends Exception {

    /**
     * Creates a new NavigationException with the given message.
     *
     * @param message description of the problem.
     */
    public NavigationException(String message) {
        super(message);
    }
}
