package org.structura.runtime.validation;

import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks shared by the slot-addressed variants (array, stack, queue).
 */
final class SlotChecks {

    private SlotChecks() {}

    /**
     * Indexes elements by slot and reports two elements sharing a slot, or a slot element
     * carrying list links.
     *
     * @return slot to element id, first occupant wins.
     */
    static Map<Integer, ElementId> occupancy(StateGraph candidate, InvariantName layoutInvariant, List<StructuralViolation> violations) {
        Map<Integer, ElementId> bySlot = new HashMap<>();
        for (Element e : candidate.elements().values()) {
            ElementId previous = bySlot.putIfAbsent(e.slot(), e.id());
            if (previous != null) {
                violations.add(StructuralViolation.of(ViolationKind.LAYOUT, layoutInvariant,
                        "slot " + e.slot() + " is occupied twice", previous, e.id()));
            }
            if (e.next() != null || e.prev() != null) {
                violations.add(StructuralViolation.of(ViolationKind.LAYOUT, layoutInvariant,
                        "slot element carries list links", e.id()));
            }
        }
        return bySlot;
    }

    /**
     * Reports elements whose slot lies outside {@code [0, capacity)}.
     */
    static void slotsWithinCapacity(StateGraph candidate, int capacity, InvariantName invariant, List<StructuralViolation> violations) {
        for (Element e : candidate.elements().values()) {
            if (e.slot() < 0 || e.slot() >= capacity) {
                violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, invariant,
                        "slot " + e.slot() + " outside [0, " + capacity + ")", e.id()));
            }
        }
    }
}
