package org.structura.runtime.model;

/**
 * The five structure shapes a {@link StateGraph} can take.
 */
public enum StructureVariant {
    /** Fixed-capacity array with a contiguous used region. */
    ARRAY(true, false),
    /** Linked list with forward links only. */
    SINGLY_LINKED(false, true),
    /** Linked list with forward and backward links. */
    DOUBLY_LINKED(false, true),
    /** Array-backed stack. */
    STACK(true, false),
    /** Circular-buffer queue. */
    QUEUE(true, false);

    private final boolean capacityRequired;
    private final boolean linked;

    StructureVariant(boolean capacityRequired, boolean linked) {
        this.capacityRequired = capacityRequired;
        this.linked = linked;
    }

    /**
     * @return true if an initial configuration of this variant must declare a capacity.
     */
    public boolean isCapacityRequired() {
        return capacityRequired;
    }

    /**
     * @return true for the two list variants, whose elements are connected by links instead of slots.
     */
    public boolean isLinked() {
        return linked;
    }
}
