package org.structura.runtime.validation;

import org.structura.runtime.model.StructureVariant;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static org.structura.runtime.model.StructureVariant.*;

/**
 * Names of the structural predicates a committed {@code StateGraph} must satisfy.
 * Plans reference these names in each step's declared invariants.
 */
public enum InvariantName {
    // region Cross-cutting
    /** Every mapping key equals the identifier of the element stored under it. */
    ELEMENT_KEYS_CONSISTENT(ARRAY, SINGLY_LINKED, DOUBLY_LINKED, STACK, QUEUE),
    /** A positional operation addressed a position inside the structure. */
    POSITION_IN_RANGE(ARRAY, SINGLY_LINKED, DOUBLY_LINKED, STACK, QUEUE),
    // endregion

    // region Array
    /** {@code size <= capacity}. */
    ARRAY_SIZE_WITHIN_CAPACITY(ARRAY),
    /** Used slots are exactly {@code [0, size)} with no gaps or duplicates. */
    ARRAY_CONTIGUOUS(ARRAY),
    // endregion

    // region Linked lists
    /** Head and tail are null or existing identifiers, and both are null exactly when the list is empty. */
    LIST_BOUNDARIES_VALID(SINGLY_LINKED, DOUBLY_LINKED),
    /** Every link field is null or an existing identifier. */
    LIST_LINKS_VALID(SINGLY_LINKED, DOUBLY_LINKED),
    /** No cycle is reachable from head. */
    LIST_ACYCLIC(SINGLY_LINKED, DOUBLY_LINKED),
    /** Traversal from head visits exactly {@code size} nodes and ends at tail. */
    LIST_SIZE_MATCHES_TRAVERSAL(SINGLY_LINKED, DOUBLY_LINKED),
    /** Every node is reachable from head. */
    LIST_NO_ORPHANS(SINGLY_LINKED, DOUBLY_LINKED),
    /** Node count does not exceed the optional capacity. */
    LIST_WITHIN_CAPACITY(SINGLY_LINKED, DOUBLY_LINKED),
    /** {@code next(n) = m} exactly when {@code prev(m) = n}. */
    DLIST_LINK_SYMMETRY(DOUBLY_LINKED),
    // endregion

    // region Stack
    /** {@code -1 <= top < capacity}. */
    STACK_TOP_IN_RANGE(STACK),
    /** Elements occupy exactly slots {@code [0, top]}. */
    STACK_CONTIGUOUS(STACK),
    // endregion

    // region Queue
    /** {@code front} and {@code rear} lie in {@code [0, capacity)}. */
    QUEUE_POINTERS_IN_RANGE(QUEUE),
    /** {@code 0 <= size <= capacity} and {@code rear = (front + size) mod capacity}. */
    QUEUE_SIZE_CONSISTENT(QUEUE),
    /** No element sits outside the logical window starting at front. */
    QUEUE_WINDOW_CONTAINMENT(QUEUE);
    // endregion

    private final Set<StructureVariant> variants;

    InvariantName(StructureVariant first, StructureVariant... rest) {
        this.variants = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    /**
     * @param variant The structure shape.
     * @return true if this invariant is part of the variant's invariant table.
     */
    public boolean appliesTo(StructureVariant variant) {
        return variants.contains(variant);
    }

    /**
     * Parses an invariant name as written in a plan.
     * @param name The name.
     * @return The invariant, or null if unknown.
     */
    public static InvariantName fromName(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
