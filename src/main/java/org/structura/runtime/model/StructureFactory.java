package org.structura.runtime.model;

import org.structura.runtime.EngineOptions;
import org.structura.runtime.api.ConfigurationException;
import org.structura.runtime.model.BoundaryMarkers.ArrayMarkers;
import org.structura.runtime.model.BoundaryMarkers.ListMarkers;
import org.structura.runtime.model.BoundaryMarkers.QueueMarkers;
import org.structura.runtime.model.BoundaryMarkers.StackMarkers;
import org.structura.runtime.validation.InvariantValidator;
import org.structura.runtime.validation.ValidationResult;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the initial {@link StateGraph} (history index 0) from a declarative configuration.
 * The result always satisfies its variant's invariants; anything else is reported as a
 * {@link ConfigurationException}.
 */
public class StructureFactory {

    private final EngineOptions options;
    private final InvariantValidator validator;

    public StructureFactory(EngineOptions options, InvariantValidator validator) {
        this.options = options;
        this.validator = validator;
    }

    /**
     * Builds the initial state.
     *
     * @param configuration The declarative configuration.
     * @return A valid state with {@code stepIndex == 0}.
     * @throws ConfigurationException if the configuration is malformed.
     */
    public StateGraph build(InitialConfiguration configuration) throws ConfigurationException {
        checkConfiguration(configuration);

        StructureVariant variant = configuration.variant();
        List<String> values = configuration.values();
        SortedMap<ElementId, Element> elements = new TreeMap<>();
        BoundaryMarkers markers;
        long ordinal = 0;

        if (variant.isLinked()) {
            boolean doubly = variant == StructureVariant.DOUBLY_LINKED;
            ElementId[] ids = new ElementId[values.size()];
            for (int i = 0; i < ids.length; i++) {
                ids[i] = ElementId.of(options.idPrefix(), ordinal++);
            }
            for (int i = 0; i < ids.length; i++) {
                elements.put(ids[i], Element.node(ids[i], values.get(i))
                        .withNext(i + 1 < ids.length ? ids[i + 1] : null)
                        .withPrev(doubly && i > 0 ? ids[i - 1] : null));
            }
            markers = ids.length == 0
                    ? ListMarkers.EMPTY
                    : new ListMarkers(ids[0], ids[ids.length - 1], ids.length);
        } else {
            for (int slot = 0; slot < values.size(); slot++) {
                ElementId id = ElementId.of(options.idPrefix(), ordinal++);
                elements.put(id, Element.slotted(id, values.get(slot), slot));
            }
            int size = values.size();
            markers = switch (variant) {
                case ARRAY -> new ArrayMarkers(size);
                case STACK -> new StackMarkers(size - 1);
                case QUEUE -> new QueueMarkers(0, size % configuration.capacity(), size);
                default -> throw new IllegalStateException("Unexpected variant " + variant);
            };
        }

        StateGraph initial = new StateGraph(variant, elements, markers, configuration.capacity(), 0,
                null, null, null, ordinal);
        ValidationResult result = validator.check(initial);
        if (!result.valid()) {
            throw new ConfigurationException("Initial " + variant + " violates its invariants: " + result.reasons());
        }
        return initial;
    }

    private void checkConfiguration(InitialConfiguration configuration) throws ConfigurationException {
        if (configuration == null) {
            throw new ConfigurationException("Initial configuration is missing");
        }
        StructureVariant variant = configuration.variant();
        if (variant == null) {
            throw new ConfigurationException("Initial configuration declares no variant");
        }
        List<String> values = configuration.values();
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new ConfigurationException("Initial value #" + i + " is null");
            }
        }
        if (values.size() > options.maxElements()) {
            throw new ConfigurationException(values.size() + " initial values exceed the limit of " + options.maxElements());
        }
        Integer capacity = configuration.capacity();
        if (capacity == null) {
            if (variant.isCapacityRequired()) {
                throw new ConfigurationException(variant + " requires a capacity");
            }
            return;
        }
        if (capacity < 1) {
            throw new ConfigurationException("Capacity must be positive: " + capacity);
        }
        if (values.size() > capacity) {
            throw new ConfigurationException(values.size() + " initial values do not fit capacity " + capacity);
        }
    }
}
