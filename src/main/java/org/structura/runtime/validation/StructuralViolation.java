package org.structura.runtime.validation;

import org.structura.runtime.model.ElementId;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One broken invariant found in a candidate state.
 *
 * @param kind The violation category.
 * @param invariant The invariant that does not hold.
 * @param reason Human readable explanation.
 * @param offendingIds Identifiers involved in the violation; may be empty.
 */
public record StructuralViolation(ViolationKind kind, InvariantName invariant, String reason, SortedSet<ElementId> offendingIds) {

    public StructuralViolation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(invariant, "invariant");
        offendingIds = Collections.unmodifiableSortedSet(offendingIds != null ? new TreeSet<>(offendingIds) : new TreeSet<>());
    }

    public static StructuralViolation of(ViolationKind kind, InvariantName invariant, String reason, ElementId... ids) {
        TreeSet<ElementId> set = new TreeSet<>();
        Arrays.stream(ids).filter(Objects::nonNull).forEach(set::add);
        return new StructuralViolation(kind, invariant, reason, set);
    }

    public static StructuralViolation of(ViolationKind kind, InvariantName invariant, String reason, Collection<ElementId> ids) {
        return new StructuralViolation(kind, invariant, reason, new TreeSet<>(ids));
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s %s", kind, invariant, reason, offendingIds);
    }
}
