package org.structura.runtime.validation;

import org.structura.runtime.model.BoundaryMarkers.QueueMarkers;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.StateGraph;

import java.util.List;

/**
 * Circular-buffer queue invariants. {@code rear} is exclusive and {@code size} is explicit, so
 * {@code rear == (front + size) mod capacity} must hold and every element must sit inside the
 * window of length {@code size} starting at {@code front}.
 */
public class QueueInvariants implements IInvariantChecker {

    @Override
    public void check(StateGraph candidate, List<StructuralViolation> violations) {
        if (!(candidate.markers() instanceof QueueMarkers markers)) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.QUEUE_SIZE_CONSISTENT,
                    "queue carries " + candidate.markers().getClass().getSimpleName()));
            return;
        }
        Integer capacity = candidate.capacity();
        if (capacity == null || capacity < 1) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.QUEUE_SIZE_CONSISTENT,
                    "queue has no positive capacity"));
            return;
        }
        int front = markers.front();
        int rear = markers.rear();
        int size = markers.size();

        boolean pointersInRange = true;
        if (front < 0 || front >= capacity) {
            violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, InvariantName.QUEUE_POINTERS_IN_RANGE,
                    "front " + front + " outside [0, " + capacity + ")"));
            pointersInRange = false;
        }
        if (rear < 0 || rear >= capacity) {
            violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, InvariantName.QUEUE_POINTERS_IN_RANGE,
                    "rear " + rear + " outside [0, " + capacity + ")"));
            pointersInRange = false;
        }
        if (size < 0 || size > capacity) {
            violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, InvariantName.QUEUE_SIZE_CONSISTENT,
                    "size " + size + " outside [0, " + capacity + "]"));
        } else if (pointersInRange && Math.floorMod(front + size, capacity) != rear) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.QUEUE_SIZE_CONSISTENT,
                    "front " + front + " + size " + size + " does not reach rear " + rear + " (mod " + capacity + ")"));
        }
        if (candidate.size() != size) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.QUEUE_SIZE_CONSISTENT,
                    "size marker " + size + " but " + candidate.size() + " elements stored"));
        }

        SlotChecks.slotsWithinCapacity(candidate, capacity, InvariantName.QUEUE_WINDOW_CONTAINMENT, violations);
        SlotChecks.occupancy(candidate, InvariantName.QUEUE_WINDOW_CONTAINMENT, violations);

        if (!pointersInRange) {
            return;
        }
        for (Element e : candidate.elements().values()) {
            if (e.slot() < 0 || e.slot() >= capacity) {
                continue;
            }
            int offset = Math.floorMod(e.slot() - front, capacity);
            if (offset >= size) {
                violations.add(StructuralViolation.of(ViolationKind.LEAK, InvariantName.QUEUE_WINDOW_CONTAINMENT,
                        "slot " + e.slot() + " lies outside the window [front " + front + ", +" + size + ")", e.id()));
            }
        }
    }

    @Override
    public InvariantName overflowInvariant() {
        return InvariantName.QUEUE_SIZE_CONSISTENT;
    }

    @Override
    public InvariantName underflowInvariant() {
        return InvariantName.QUEUE_SIZE_CONSISTENT;
    }
}
