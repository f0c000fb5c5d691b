package org.structura.runtime.validation;

/**
 * Category of a {@link StructuralViolation}.
 */
public enum ViolationKind {
    /** An index, position or counter left its legal range (includes overflow and underflow). */
    OUT_OF_BOUNDS,
    /** Traversal from head did not reach a terminator. */
    CYCLE,
    /** An element is reachable from no boundary marker. */
    LEAK,
    /** A link or boundary marker names an identifier that does not exist. */
    POINTER,
    /** Forward and backward links of a doubly linked list disagree. */
    SYMMETRY,
    /** Slots, sizes or markers are inconsistent with each other. */
    LAYOUT
}
