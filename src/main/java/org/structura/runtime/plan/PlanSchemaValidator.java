package org.structura.runtime.plan;

import org.structura.runtime.Config;
import org.structura.runtime.EngineOptions;
import org.structura.runtime.api.SchemaException;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.validation.InvariantName;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the shape of a plan before any step runs: contiguous numbering from 0, known
 * operations supported by the plan's variant, required parameters present and well formed, and
 * at least one applicable declared invariant per step. All problems are collected and reported
 * together.
 */
public class PlanSchemaValidator {

    private final EngineOptions options;

    public PlanSchemaValidator(EngineOptions options) {
        this.options = options;
    }

    /**
     * Validates a plan.
     *
     * @param plan The plan.
     * @throws SchemaException listing every problem found.
     */
    public void validate(ExecutionPlan plan) throws SchemaException {
        if (plan == null) {
            throw new SchemaException("Plan is null");
        }
        if (plan.initialConfiguration() == null) {
            throw new SchemaException("Plan '" + plan.planId() + "' declares no initial configuration");
        }
        List<String> problems = new ArrayList<>();
        if (plan.size() > options.maxPlanSteps()) {
            problems.add("plan has " + plan.size() + " steps, limit is " + options.maxPlanSteps());
        }

        StructureVariant variant = plan.initialConfiguration().variant();
        for (int i = 0; i < plan.size(); i++) {
            Step step = plan.step(i);
            if (step == null) {
                problems.add("step #" + i + " is null");
                continue;
            }
            String where = "step #" + i;
            if (step.stepIndex() != i) {
                problems.add(where + " is numbered " + step.stepIndex() + ", expected " + i);
            }
            OperationKind kind = step.operationKind();
            if (kind == null) {
                problems.add(where + " has no operation kind");
                continue;
            }
            if (variant != null && !kind.supports(variant)) {
                problems.add(where + ": " + kind + " is not supported by " + variant);
            }
            checkParameters(step, where, problems);
            checkInvariants(step, variant, where, problems);
        }

        if (!problems.isEmpty()) {
            throw new SchemaException("Plan '" + plan.planId() + "' is malformed:\n  " + String.join("\n  ", problems));
        }
    }

    private void checkParameters(Step step, String where, List<String> problems) {
        for (String key : step.operationKind().requiredParameters()) {
            String raw = step.parameter(key);
            if (raw == null || raw.isBlank()) {
                problems.add(where + ": " + step.operationKind() + " requires parameter '" + key + "'");
            } else if (Config.PARAM_POSITION.equals(key)) {
                try {
                    Integer.parseInt(raw.trim());
                } catch (NumberFormatException e) {
                    problems.add(where + ": position '" + raw + "' is not an integer");
                }
            }
        }
    }

    private void checkInvariants(Step step, StructureVariant variant, String where, List<String> problems) {
        if (step.declaredInvariants().isEmpty()) {
            problems.add(where + " declares no invariants");
            return;
        }
        for (String name : step.declaredInvariants()) {
            InvariantName invariant = InvariantName.fromName(name);
            if (invariant == null) {
                problems.add(where + " declares unknown invariant '" + name + "'");
            } else if (variant != null && !invariant.appliesTo(variant)) {
                problems.add(where + " declares " + invariant + ", which does not apply to " + variant);
            }
        }
    }
}
