package org.structura.runtime;

import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.plan.Step;
import org.structura.runtime.validation.InvariantName;
import org.structura.runtime.validation.StructuralViolation;
import org.structura.runtime.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Outcome of one {@link ExecutionEngine#applyStep(int)} call. A rejection is a normal result,
 * not an exception: callers check {@link #success()} and read {@link #errors()}.
 *
 * @param success True if the candidate was committed.
 * @param step The step that was applied.
 * @param newState The committed snapshot, or null on rejection.
 * @param modifiedElementIds Identifiers the step created, removed, mutated or read; empty on rejection.
 * @param errors Violations that caused a rejection; empty on success.
 * @param invariantsPreserved True exactly when the candidate passed validation.
 * @param edgeCase The transform's edge-case marker, or null.
 */
public record StateTransitionResult(
        boolean success,
        Step step,
        StateGraph newState,
        SortedSet<ElementId> modifiedElementIds,
        List<StructuralViolation> errors,
        boolean invariantsPreserved,
        EdgeCase edgeCase
) {
    public StateTransitionResult {
        modifiedElementIds = Collections.unmodifiableSortedSet(modifiedElementIds != null ? new TreeSet<>(modifiedElementIds) : new TreeSet<>());
        errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
    }

    static StateTransitionResult committed(Step step, StateGraph state) {
        return new StateTransitionResult(true, step, state, state.modifiedElementIds(), List.of(), true, state.edgeCase());
    }

    static StateTransitionResult rejected(Step step, StateGraph candidate, ValidationResult validation) {
        return new StateTransitionResult(false, step, null, null, validation.violations(), false, candidate.edgeCase());
    }

    /**
     * @return the plan index of the applied step.
     */
    public int stepIndex() {
        return step.stepIndex();
    }

    /**
     * @return distinct violated invariant names, in report order.
     */
    public List<InvariantName> violatedInvariants() {
        return new ArrayList<>(errors.stream()
                .map(StructuralViolation::invariant)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }
}
