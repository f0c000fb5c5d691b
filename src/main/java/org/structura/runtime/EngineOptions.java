package org.structura.runtime;

import com.typesafe.config.ConfigFactory;

/**
 * Tunables of an {@link ExecutionEngine}, read from the {@code structura.engine} block.
 *
 * <pre>
 * structura.engine {
 *   max-plan-steps = 1000
 *   max-elements = 256
 *   id-prefix = "n"
 * }
 * </pre>
 *
 * @param maxPlanSteps Upper bound on the number of steps in a plan.
 * @param maxElements Upper bound on the number of values in an initial configuration.
 * @param idPrefix Prefix of generated element identifiers.
 */
public record EngineOptions(int maxPlanSteps, int maxElements, String idPrefix) {

    private static final String ENGINE_PATH = "structura.engine";

    public EngineOptions {
        if (maxPlanSteps < 1) {
            throw new IllegalArgumentException("max-plan-steps must be positive: " + maxPlanSteps);
        }
        if (maxElements < 1) {
            throw new IllegalArgumentException("max-elements must be positive: " + maxElements);
        }
        if (idPrefix == null || idPrefix.isBlank()) {
            throw new IllegalArgumentException("id-prefix must not be blank");
        }
    }

    /**
     * @return the built-in defaults from {@link Config}.
     */
    public static EngineOptions defaults() {
        return new EngineOptions(Config.DEFAULT_MAX_PLAN_STEPS, Config.DEFAULT_MAX_ELEMENTS, Config.DEFAULT_ID_PREFIX);
    }

    /**
     * Reads the engine block, falling back to the defaults for missing keys.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static EngineOptions fromConfig(com.typesafe.config.Config config) {
        com.typesafe.config.Config engine = config.hasPath(ENGINE_PATH)
                ? config.getConfig(ENGINE_PATH)
                : ConfigFactory.empty();
        return new EngineOptions(
                engine.hasPath("max-plan-steps") ? engine.getInt("max-plan-steps") : Config.DEFAULT_MAX_PLAN_STEPS,
                engine.hasPath("max-elements") ? engine.getInt("max-elements") : Config.DEFAULT_MAX_ELEMENTS,
                engine.hasPath("id-prefix") ? engine.getString("id-prefix") : Config.DEFAULT_ID_PREFIX);
    }
}
