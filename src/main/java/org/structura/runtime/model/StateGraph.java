package org.structura.runtime.model;

import org.structura.runtime.model.BoundaryMarkers.ListMarkers;
import org.structura.runtime.model.BoundaryMarkers.QueueMarkers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of one structure at one point in its history.
 * <p>
 * Every relationship is an identifier lookup into {@link #elements()}. The record does not
 * check structural legality: a transform may produce an illegal candidate, and only the
 * validator decides whether it can be committed.
 *
 * @param variant The structure shape.
 * @param elements Identifier to element mapping (the arena).
 * @param markers Variant-specific boundary markers.
 * @param capacity Capacity of bounded variants, or null for an unbounded list.
 * @param stepIndex Position of this snapshot in history (0 = initial state).
 * @param modifiedElementIds Identifiers created, removed, mutated or read by the step that produced this state.
 * @param edgeCase Marker left by the transform, or null.
 * @param observedValue Value read by the step (popped, peeked, accessed, found position), or null.
 * @param nextOrdinal Ordinal the next allocated identifier will use.
 */
public record StateGraph(
        StructureVariant variant,
        SortedMap<ElementId, Element> elements,
        BoundaryMarkers markers,
        Integer capacity,
        int stepIndex,
        SortedSet<ElementId> modifiedElementIds,
        EdgeCase edgeCase,
        String observedValue,
        long nextOrdinal
) {
    public StateGraph {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(markers, "markers");
        elements = Collections.unmodifiableSortedMap(elements != null ? new TreeMap<>(elements) : new TreeMap<>());
        modifiedElementIds = Collections.unmodifiableSortedSet(
                modifiedElementIds != null ? new TreeSet<>(modifiedElementIds) : new TreeSet<>());
    }

    /**
     * Returns the element with the given identifier.
     * @param id The identifier, may be null.
     * @return The element, or null if the identifier is null or unknown.
     */
    public Element element(ElementId id) {
        return id == null ? null : elements.get(id);
    }

    /**
     * @param id The identifier.
     * @return true if the element mapping contains the identifier.
     */
    public boolean contains(ElementId id) {
        return id != null && elements.containsKey(id);
    }

    /**
     * @return the number of entries in the element mapping.
     */
    public int size() {
        return elements.size();
    }

    /**
     * Casts the boundary markers to the expected variant type.
     * @param type The marker record type.
     * @param <T> The marker type.
     * @return The markers.
     * @throws IllegalStateException if the markers are of another type.
     */
    public <T extends BoundaryMarkers> T markersAs(Class<T> type) {
        if (!type.isInstance(markers)) {
            throw new IllegalStateException("Expected " + type.getSimpleName() + " for " + variant + " but found " + markers);
        }
        return type.cast(markers);
    }

    /**
     * Returns the elements in logical order: traversal order from head for lists, slot order
     * for arrays and stacks (bottom first), window order from front for queues.
     * List traversal is bounded and stops at a missing link or a revisited node, so this is
     * safe to call on an illegal candidate.
     *
     * @return The elements in logical order.
     */
    public List<Element> orderedElements() {
        if (variant.isLinked()) {
            List<Element> ordered = new ArrayList<>();
            Set<ElementId> seen = new HashSet<>();
            ElementId cursor = markers instanceof ListMarkers list ? list.head() : null;
            while (cursor != null && elements.containsKey(cursor) && seen.add(cursor)) {
                Element current = elements.get(cursor);
                ordered.add(current);
                cursor = current.next();
            }
            return ordered;
        }
        if (variant == StructureVariant.QUEUE && markers instanceof QueueMarkers queue && capacity != null && capacity > 0) {
            int front = queue.front();
            int cap = capacity;
            return elements.values().stream()
                    .sorted(Comparator.comparingInt(e -> Math.floorMod(e.slot() - front, cap)))
                    .collect(Collectors.toList());
        }
        return elements.values().stream()
                .sorted(Comparator.comparingInt(Element::slot))
                .collect(Collectors.toList());
    }

    /**
     * @return the values in logical order, see {@link #orderedElements()}.
     */
    public List<String> orderedValues() {
        return orderedElements().stream().map(Element::value).collect(Collectors.toList());
    }

    /**
     * Finds the first element in logical order carrying the value.
     * @param value The value.
     * @return The element, or null.
     */
    public Element findFirst(String value) {
        for (Element e : orderedElements()) {
            if (Objects.equals(e.value(), value)) {
                return e;
            }
        }
        return null;
    }

    /**
     * Returns a copy of this snapshot positioned at the given history index.
     * @param index The history index.
     * @return The repositioned snapshot.
     */
    public StateGraph atStepIndex(int index) {
        return new StateGraph(variant, elements, markers, capacity, index, modifiedElementIds, edgeCase, observedValue, nextOrdinal);
    }
}
