package org.structura.runtime.transforms;

import org.structura.runtime.model.StateGraph;
import org.structura.runtime.plan.Step;

/**
 * A pure mapping from the current committed state and a step to a candidate state.
 * <p>
 * Implementations never decide legality and never throw for a precondition failure; they
 * return an unchanged candidate tagged with an {@code EdgeCase} instead.
 */
@FunctionalInterface
public interface IStepTransform {

    /**
     * @param editor Working copy of the current state.
     * @param step The step to apply.
     * @return The candidate state.
     */
    StateGraph apply(StateEditor editor, Step step);
}
