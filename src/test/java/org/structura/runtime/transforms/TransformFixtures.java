package org.structura.runtime.transforms;

import org.structura.runtime.Config;
import org.structura.runtime.EngineOptions;
import org.structura.runtime.model.InitialConfiguration;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureFactory;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.plan.Step;
import org.structura.runtime.validation.InvariantValidator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for the transform tests: build a valid starting state and run a single step.
 */
final class TransformFixtures {

    static final TransformRegistry REGISTRY = TransformRegistry.standard(Config.DEFAULT_ID_PREFIX);
    private static final StructureFactory FACTORY = new StructureFactory(EngineOptions.defaults(), new InvariantValidator());

    private TransformFixtures() {}

    static StateGraph state(StructureVariant variant, Integer capacity, String... values) {
        try {
            return FACTORY.build(InitialConfiguration.of(variant, capacity, values));
        } catch (Exception e) {
            throw new IllegalArgumentException("Bad fixture", e);
        }
    }

    static StateGraph apply(StateGraph state, OperationKind kind, String... keyValues) {
        Map<String, String> parameters = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            parameters.put(keyValues[i], keyValues[i + 1]);
        }
        return REGISTRY.apply(state, new Step(0, kind, parameters, List.of("POSITION_IN_RANGE"), null));
    }

    static String[] value(String value) {
        return new String[]{Config.PARAM_VALUE, value};
    }

    static String[] position(int position) {
        return new String[]{Config.PARAM_POSITION, Integer.toString(position)};
    }

    static String[] positionValue(int position, String value) {
        return new String[]{Config.PARAM_POSITION, Integer.toString(position), Config.PARAM_VALUE, value};
    }
}
