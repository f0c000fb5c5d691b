package org.structura.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative starting point of a plan: which structure, which values, how much room.
 *
 * @param variant The structure shape.
 * @param values The initial values in logical order (head first, bottom first, front first).
 * @param capacity Capacity for bounded variants; optional for lists.
 */
public record InitialConfiguration(StructureVariant variant, List<String> values, Integer capacity) {

    public InitialConfiguration {
        values = values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : List.of();
    }

    /**
     * Convenience factory for tests and in-process callers.
     */
    public static InitialConfiguration of(StructureVariant variant, Integer capacity, String... values) {
        return new InitialConfiguration(variant, List.of(values), capacity);
    }
}
