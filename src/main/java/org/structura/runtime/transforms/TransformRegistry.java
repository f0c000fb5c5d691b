package org.structura.runtime.transforms;

import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.plan.Step;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each (variant, operation) pair to its transform.
 * <p>
 * A registry is built once per engine and is read-only afterwards. {@link #standard(String)}
 * wires every built-in transform; the package-private {@link #register} exists for tests that
 * need a deliberately broken transform.
 */
public final class TransformRegistry {

    private final Map<StructureVariant, Map<OperationKind, IStepTransform>> transforms = new EnumMap<>(StructureVariant.class);
    private final String idPrefix;

    TransformRegistry(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    /**
     * Creates a registry holding all built-in transforms.
     *
     * @param idPrefix Prefix of identifiers allocated by insert operations.
     * @return The registry.
     */
    public static TransformRegistry standard(String idPrefix) {
        TransformRegistry registry = new TransformRegistry(idPrefix);
        ArrayTransforms.registerAll(registry);
        LinkedListTransforms.registerAll(registry);
        StackTransforms.registerAll(registry);
        QueueTransforms.registerAll(registry);
        ReadTransforms.registerAll(registry);
        return registry;
    }

    TransformRegistry register(StructureVariant variant, OperationKind kind, IStepTransform transform) {
        transforms.computeIfAbsent(variant, v -> new EnumMap<>(OperationKind.class)).put(kind, transform);
        return this;
    }

    /**
     * @return the transform for the pair, if one is registered.
     */
    public Optional<IStepTransform> find(StructureVariant variant, OperationKind kind) {
        return Optional.ofNullable(transforms.getOrDefault(variant, Collections.emptyMap()).get(kind));
    }

    /**
     * Runs the registered transform for the step against a working copy of {@code current}.
     *
     * @param current The committed state.
     * @param step The step.
     * @return The candidate state; {@code current} is left untouched.
     * @throws IllegalStateException if no transform is registered for the pair.
     */
    public StateGraph apply(StateGraph current, Step step) {
        IStepTransform transform = find(current.variant(), step.operationKind())
                .orElseThrow(() -> new IllegalStateException(
                        "No transform registered for " + step.operationKind() + " on " + current.variant()));
        return transform.apply(new StateEditor(current, idPrefix), step);
    }
}
