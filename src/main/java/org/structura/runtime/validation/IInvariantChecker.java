package org.structura.runtime.validation;

import org.structura.runtime.model.StateGraph;

import java.util.List;

/**
 * Variant-specific part of the invariant table. Implementations are pure: they only read the
 * candidate and append what they find.
 */
public interface IInvariantChecker {

    /**
     * Evaluates the variant's invariants on a candidate.
     *
     * @param candidate The state to check.
     * @param violations Sink for the violations found.
     */
    void check(StateGraph candidate, List<StructuralViolation> violations);

    /**
     * @return the invariant an {@code OVERFLOW} candidate breaks for this variant.
     */
    InvariantName overflowInvariant();

    /**
     * @return the invariant an {@code UNDERFLOW} candidate breaks for this variant.
     */
    InvariantName underflowInvariant();
}
