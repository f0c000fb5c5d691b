package org.structura.runtime;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EngineOptionsTest {

    @Test
    void referenceConfMatchesBuiltInDefaults() {
        EngineOptions fromReference = EngineOptions.fromConfig(ConfigFactory.parseResources("reference.conf").resolve());

        assertThat(fromReference).isEqualTo(EngineOptions.defaults());
    }

    @Test
    void overridesAndFallbacksAreMerged() {
        EngineOptions options = EngineOptions.fromConfig(ConfigFactory.parseString("""
                structura.engine {
                  max-elements = 8
                  id-prefix = "node"
                }
                """));

        assertThat(options.maxElements()).isEqualTo(8);
        assertThat(options.idPrefix()).isEqualTo("node");
        assertThat(options.maxPlanSteps()).isEqualTo(Config.DEFAULT_MAX_PLAN_STEPS);
    }

    @Test
    void emptyConfigurationYieldsDefaults() {
        assertThat(EngineOptions.fromConfig(ConfigFactory.empty())).isEqualTo(EngineOptions.defaults());
    }

    @Test
    void invalidValuesAreRefused() {
        assertThatThrownBy(() -> EngineOptions.fromConfig(ConfigFactory.parseString("structura.engine.max-plan-steps = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-plan-steps");
        assertThatThrownBy(() -> new EngineOptions(1, 1, " ")).isInstanceOf(IllegalArgumentException.class);
    }
}
