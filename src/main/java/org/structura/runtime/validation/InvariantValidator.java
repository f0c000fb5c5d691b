package org.structura.runtime.validation;

import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a candidate state may be committed.
 * <p>
 * The validator runs the cross-cutting checks, the variant's invariant table and the edge-case
 * mapping (a candidate marked {@code OVERFLOW}, {@code UNDERFLOW} or {@code OUT_OF_BOUNDS}
 * describes an illegal access even though its contents are unchanged). It never mutates the
 * candidate and keeps no state between calls, so one instance may be shared by readers.
 */
public class InvariantValidator {

    private final Map<StructureVariant, IInvariantChecker> checkers;

    /**
     * Creates a validator with the built-in checker for every variant.
     */
    public InvariantValidator() {
        Map<StructureVariant, IInvariantChecker> map = new EnumMap<>(StructureVariant.class);
        map.put(StructureVariant.ARRAY, new ArrayInvariants());
        map.put(StructureVariant.SINGLY_LINKED, new LinkedListInvariants(StructureVariant.SINGLY_LINKED));
        map.put(StructureVariant.DOUBLY_LINKED, new LinkedListInvariants(StructureVariant.DOUBLY_LINKED));
        map.put(StructureVariant.STACK, new StackInvariants());
        map.put(StructureVariant.QUEUE, new QueueInvariants());
        this.checkers = Collections.unmodifiableMap(map);
    }

    /**
     * Validates a candidate state.
     *
     * @param candidate The state to check.
     * @return The validation outcome; {@link ValidationResult#valid()} is true when no invariant is broken.
     */
    public ValidationResult check(StateGraph candidate) {
        IInvariantChecker checker = checkers.get(candidate.variant());
        List<StructuralViolation> violations = new ArrayList<>();

        checkEdgeCase(candidate, checker, violations);
        checkKeys(candidate, violations);
        checker.check(candidate, violations);

        return violations.isEmpty() ? ValidationResult.VALID : new ValidationResult(violations);
    }

    private void checkEdgeCase(StateGraph candidate, IInvariantChecker checker, List<StructuralViolation> violations) {
        EdgeCase edgeCase = candidate.edgeCase();
        if (edgeCase == null || !edgeCase.isRejecting()) {
            return;
        }
        switch (edgeCase) {
            case OVERFLOW -> violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, checker.overflowInvariant(),
                    "insert would exceed capacity " + candidate.capacity()));
            case UNDERFLOW -> violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, checker.underflowInvariant(),
                    "removal or read from an empty " + candidate.variant()));
            case OUT_OF_BOUNDS -> violations.add(StructuralViolation.of(ViolationKind.OUT_OF_BOUNDS, InvariantName.POSITION_IN_RANGE,
                    "position outside [0, " + candidate.markers().declaredSize() + "]"));
            case UNKNOWN_ELEMENT -> violations.add(StructuralViolation.of(ViolationKind.POINTER, InvariantName.LIST_LINKS_VALID,
                    "pointer rewrite names an element that does not exist"));
            default -> throw new IllegalStateException("Unhandled rejecting edge case " + edgeCase);
        }
    }

    private void checkKeys(StateGraph candidate, List<StructuralViolation> violations) {
        for (Map.Entry<ElementId, Element> entry : candidate.elements().entrySet()) {
            if (!entry.getKey().equals(entry.getValue().id())) {
                violations.add(StructuralViolation.of(ViolationKind.LAYOUT, InvariantName.ELEMENT_KEYS_CONSISTENT,
                        "key " + entry.getKey() + " holds element " + entry.getValue().id(), entry.getKey()));
            }
        }
    }
}
