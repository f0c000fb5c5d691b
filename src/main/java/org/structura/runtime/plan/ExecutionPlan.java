package org.structura.runtime.plan;

import org.structura.runtime.model.InitialConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, zero-indexed list of steps together with the structure they start from.
 * Plans are produced upstream; the execution core only consumes them.
 *
 * @param planId Identifier of the plan, used in log lines.
 * @param initialConfiguration The starting structure.
 * @param steps The steps in execution order.
 */
public record ExecutionPlan(String planId, InitialConfiguration initialConfiguration, List<Step> steps) {

    public ExecutionPlan {
        planId = planId != null ? planId : "unnamed";
        steps = steps != null ? Collections.unmodifiableList(new ArrayList<>(steps)) : List.of();
    }

    /**
     * @param index A plan step index.
     * @return the step.
     * @throws IndexOutOfBoundsException if the plan has no such step.
     */
    public Step step(int index) {
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }
}
