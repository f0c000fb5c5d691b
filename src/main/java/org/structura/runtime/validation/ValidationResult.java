package org.structura.runtime.validation;

import org.structura.runtime.model.ElementId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Outcome of validating one candidate state.
 *
 * @param violations Every violation found, in the order the checks ran. Empty when valid.
 */
public record ValidationResult(List<StructuralViolation> violations) {

    public static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        violations = violations != null ? Collections.unmodifiableList(new ArrayList<>(violations)) : List.of();
    }

    public boolean valid() {
        return violations.isEmpty();
    }

    /**
     * @return the distinct violated invariant names, in report order.
     */
    public List<InvariantName> violated() {
        return new ArrayList<>(violations.stream()
                .map(StructuralViolation::invariant)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    /**
     * @return one reason line per violation.
     */
    public List<String> reasons() {
        return violations.stream().map(StructuralViolation::toString).collect(Collectors.toList());
    }

    /**
     * @return the union of all offending identifiers.
     */
    public SortedSet<ElementId> offendingIds() {
        SortedSet<ElementId> ids = new TreeSet<>();
        violations.forEach(v -> ids.addAll(v.offendingIds()));
        return ids;
    }

    /**
     * @param kind A violation category.
     * @return true if at least one violation is of that category.
     */
    public boolean has(ViolationKind kind) {
        return violations.stream().anyMatch(v -> v.kind() == kind);
    }
}
