package org.structura.runtime;

import org.structura.runtime.model.ElementId;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.validation.InvariantName;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Log entry for a refused step, kept for external consumers.
 *
 * @param stepIndex Plan index of the refused step.
 * @param operationKind Operation of the refused step.
 * @param violated Violated invariant names.
 * @param offendingIds Identifiers involved in the violations.
 * @param reasons One line per violation.
 */
public record RejectionRecord(
        int stepIndex,
        OperationKind operationKind,
        List<InvariantName> violated,
        SortedSet<ElementId> offendingIds,
        List<String> reasons
) {
    public RejectionRecord {
        violated = List.copyOf(violated);
        offendingIds = Collections.unmodifiableSortedSet(new TreeSet<>(offendingIds));
        reasons = List.copyOf(reasons);
    }
}
