package org.structura.runtime.model;

/**
 * Markers a transform attaches to a candidate when the step hit a precondition boundary.
 * Whether the marker makes the candidate illegal is decided by the validator.
 */
public enum EdgeCase {
    /** Insert into a full bounded structure. */
    OVERFLOW(true),
    /** Removal or read from an empty structure. */
    UNDERFLOW(true),
    /** Position outside the valid range for the operation. */
    OUT_OF_BOUNDS(true),
    /** A pointer rewrite names an element that does not exist. */
    UNKNOWN_ELEMENT(true),
    /** Searched or deleted value is not present. */
    NOT_FOUND(false),
    /** Traversal of an empty structure. */
    EMPTY(false);

    private final boolean rejecting;

    EdgeCase(boolean rejecting) {
        this.rejecting = rejecting;
    }

    /**
     * @return true if a candidate carrying this marker describes an illegal access.
     */
    public boolean isRejecting() {
        return rejecting;
    }
}
