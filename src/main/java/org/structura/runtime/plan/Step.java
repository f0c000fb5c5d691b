package org.structura.runtime.plan;

import org.structura.runtime.Config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One planned operation.
 *
 * @param stepIndex Position in the plan, contiguous from 0.
 * @param operationKind The requested operation.
 * @param parameters Operation-specific parameters ({@code value}, {@code position}, {@code from}, {@code to}).
 * @param declaredInvariants Names of the invariants the step must preserve; at least one.
 * @param edgeCaseTag Optional tag the planner attached (e.g. "empty-list"), passed through untouched.
 */
public record Step(
        int stepIndex,
        OperationKind operationKind,
        Map<String, String> parameters,
        List<String> declaredInvariants,
        String edgeCaseTag
) {
    public Step {
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        declaredInvariants = declaredInvariants != null ? Collections.unmodifiableList(new ArrayList<>(declaredInvariants)) : List.of();
    }

    /**
     * @return the {@code value} parameter, or null.
     */
    public String value() {
        return parameters.get(Config.PARAM_VALUE);
    }

    /**
     * Reads the {@code position} parameter. Plans are schema-checked before execution, so a
     * missing or malformed position here is a programming error.
     *
     * @return the position.
     * @throws IllegalStateException if the parameter is missing or not an integer.
     */
    public int position() {
        String raw = parameters.get(Config.PARAM_POSITION);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NullPointerException | NumberFormatException e) {
            throw new IllegalStateException("Step " + stepIndex + " has no integer position: " + raw, e);
        }
    }

    /**
     * @param key A parameter key.
     * @return the parameter, or null.
     */
    public String parameter(String key) {
        return parameters.get(key);
    }
}
