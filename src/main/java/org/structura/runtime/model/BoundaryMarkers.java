package org.structura.runtime.model;

/**
 * Variant-specific boundary markers of a {@link StateGraph}: where a structure begins and ends.
 * Markers are plain values; they are not checked on construction so that a transform can
 * describe an illegal candidate for the validator to reject.
 */
public sealed interface BoundaryMarkers permits BoundaryMarkers.ListMarkers, BoundaryMarkers.ArrayMarkers,
        BoundaryMarkers.StackMarkers, BoundaryMarkers.QueueMarkers {

    /**
     * @return the number of elements the markers claim are stored.
     */
    int declaredSize();

    /**
     * Head and tail of a singly or doubly linked list.
     * @param head First node, or null when empty.
     * @param tail Last node, or null when empty.
     * @param size Number of nodes reachable from head.
     */
    record ListMarkers(ElementId head, ElementId tail, int size) implements BoundaryMarkers {
        public static final ListMarkers EMPTY = new ListMarkers(null, null, 0);

        @Override
        public int declaredSize() {
            return size;
        }
    }

    /**
     * Used region of an array, always {@code [0, size)}.
     * @param size Number of used slots.
     */
    record ArrayMarkers(int size) implements BoundaryMarkers {
        @Override
        public int declaredSize() {
            return size;
        }
    }

    /**
     * Top of an array-backed stack; {@code -1} when empty.
     * @param top Index of the topmost occupied slot.
     */
    record StackMarkers(int top) implements BoundaryMarkers {
        @Override
        public int declaredSize() {
            return top + 1;
        }
    }

    /**
     * Circular-buffer window of a queue. {@code rear} is exclusive; {@code size} tells a full
     * buffer from an empty one when {@code front == rear}.
     * @param front Slot of the oldest element.
     * @param rear Slot the next enqueue writes to.
     * @param size Number of queued elements.
     */
    record QueueMarkers(int front, int rear, int size) implements BoundaryMarkers {
        @Override
        public int declaredSize() {
            return size;
        }
    }
}
