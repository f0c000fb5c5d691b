package org.structura.runtime.validation;

import org.structura.runtime.Config;
import org.structura.runtime.model.BoundaryMarkers.StackMarkers;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;

import java.util.List;
import java.util.Map;

/**
 * Stack invariants: {@code -1 <= top < capacity} and elements in exactly {@code [0, top]}.
 */
public class StackInvariants implements IInvariantChecker {

    @Override
    public void check(StateGraph candidate, List<StructuralViolation> violations) {
        if (!(candidate.markers() instanceof StackMarkers markers)) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.STACK_CONTIGUOUS,
                    "stack carries " + candidate.markers().getClass().getSimpleName()));
            return;
        }
        Integer capacity = candidate.capacity();
        if (capacity == null || capacity < 1) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.STACK_TOP_IN_RANGE,
                    "stack has no positive capacity"));
            return;
        }
        int top = markers.top();
        if (top < Config.EMPTY_STACK_TOP || top >= capacity) {
            violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, InvariantName.STACK_TOP_IN_RANGE,
                    "top " + top + " outside [-1, " + capacity + ")"));
        }
        if (candidate.size() != top + 1) {
            violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.STACK_CONTIGUOUS,
                    "top " + top + " but " + candidate.size() + " elements stored"));
        }

        SlotChecks.slotsWithinCapacity(candidate, capacity, InvariantName.STACK_TOP_IN_RANGE, violations);
        Map<Integer, ElementId> occupied = SlotChecks.occupancy(candidate, InvariantName.STACK_CONTIGUOUS, violations);

        for (Element e : candidate.elements().values()) {
            if (e.slot() > top && e.slot() < capacity) {
                violations.add(StructuralViolation.of(ViolationKind.LEAK, InvariantName.STACK_CONTIGUOUS,
                        "slot " + e.slot() + " lies above top " + top, e.id()));
            }
        }
        for (int slot = 0; slot <= Math.min(top, capacity - 1); slot++) {
            if (!occupied.containsKey(slot)) {
                violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.STACK_CONTIGUOUS,
                        "gap at slot " + slot));
            }
        }
    }

    @Override
    public InvariantName overflowInvariant() {
        return InvariantName.STACK_TOP_IN_RANGE;
    }

    @Override
    public InvariantName underflowInvariant() {
        return InvariantName.STACK_TOP_IN_RANGE;
    }
}
