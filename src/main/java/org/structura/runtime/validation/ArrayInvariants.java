package org.structura.runtime.validation;

import org.structura.runtime.model.BoundaryMarkers.ArrayMarkers;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;

import java.util.List;
import java.util.Map;

/**
 * Array invariants: {@code size <= capacity} and a gap-free used region {@code [0, size)}.
 */
public class ArrayInvariants implements IInvariantChecker {

    @Override
    public void check(StateGraph candidate, List<StructuralViolation> violations) {
        if (!(candidate.markers() instanceof ArrayMarkers markers)) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.ARRAY_CONTIGUOUS,
                    "array carries " + candidate.markers().getClass().getSimpleName()));
            return;
        }
        Integer capacity = candidate.capacity();
        int size = markers.size();

        if (capacity == null || capacity < 1) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.ARRAY_SIZE_WITHIN_CAPACITY,
                    "array has no positive capacity"));
            return;
        }
        if (size < 0 || size > capacity) {
            violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, InvariantName.ARRAY_SIZE_WITHIN_CAPACITY,
                    "size " + size + " outside [0, " + capacity + "]"));
        }
        if (candidate.size() != size) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.ARRAY_CONTIGUOUS,
                    "size marker " + size + " but " + candidate.size() + " elements stored"));
        }

        SlotChecks.slotsWithinCapacity(candidate, capacity, InvariantName.ARRAY_SIZE_WITHIN_CAPACITY, violations);
        Map<Integer, ElementId> occupied = SlotChecks.occupancy(candidate, InvariantName.ARRAY_CONTIGUOUS, violations);

        for (Element e : candidate.elements().values()) {
            if (e.slot() >= size && e.slot() < capacity) {
                violations.add(StructuralViolation.of(ViolationKind.LEAK, InvariantName.ARRAY_CONTIGUOUS,
                        "slot " + e.slot() + " lies beyond the used region [0, " + size + ")", e.id()));
            }
        }
        for (int slot = 0; slot < Math.min(size, capacity); slot++) {
            if (!occupied.containsKey(slot)) {
                violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.ARRAY_CONTIGUOUS,
                        "gap at slot " + slot));
            }
        }
    }

    @Override
    public InvariantName overflowInvariant() {
        return InvariantName.ARRAY_SIZE_WITHIN_CAPACITY;
    }

    @Override
    public InvariantName underflowInvariant() {
        return InvariantName.POSITION_IN_RANGE;
    }
}
