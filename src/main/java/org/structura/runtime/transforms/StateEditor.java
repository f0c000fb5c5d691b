package org.structura.runtime.transforms;

import org.structura.runtime.model.BoundaryMarkers;
import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;

import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Private working copy of a {@link StateGraph} used by one transform invocation.
 * <p>
 * The editor copies the element mapping on creation, so the source snapshot is never touched.
 * Every write records the identifier it touched; {@link #build()} turns the copy into a
 * candidate carrying those identifiers.
 */
public final class StateEditor {

    private final StateGraph source;
    private final String idPrefix;
    private final SortedMap<ElementId, Element> elements;
    private final SortedSet<ElementId> touched = new TreeSet<>();
    private BoundaryMarkers markers;
    private EdgeCase edgeCase;
    private String observedValue;
    private long nextOrdinal;

    StateEditor(StateGraph source, String idPrefix) {
        this.source = source;
        this.idPrefix = idPrefix;
        this.elements = new TreeMap<>(source.elements());
        this.markers = source.markers();
        this.nextOrdinal = source.nextOrdinal();
    }

    StateGraph current() {
        return source;
    }

    /**
     * @return the element stored in the slot, or null.
     */
    Element atSlot(int slot) {
        for (Element e : elements.values()) {
            if (e.slot() == slot) {
                return e;
            }
        }
        return null;
    }

    Element get(ElementId id) {
        return id == null ? null : elements.get(id);
    }

    /**
     * Allocates a fresh identifier and stores the element produced for it.
     */
    ElementId create(Function<ElementId, Element> factory) {
        ElementId id = ElementId.of(idPrefix, nextOrdinal++);
        elements.put(id, factory.apply(id));
        touched.add(id);
        return id;
    }

    void put(Element element) {
        elements.put(element.id(), element);
        touched.add(element.id());
    }

    void remove(ElementId id) {
        elements.remove(id);
        touched.add(id);
    }

    /**
     * Marks an element as read without changing it.
     */
    void read(ElementId id) {
        if (id != null) {
            touched.add(id);
        }
    }

    void setNext(ElementId id, ElementId next) {
        Element e = elements.get(id);
        if (e != null && !Objects.equals(e.next(), next)) {
            put(e.withNext(next));
        }
    }

    void setPrev(ElementId id, ElementId prev) {
        Element e = elements.get(id);
        if (e != null && !Objects.equals(e.prev(), prev)) {
            put(e.withPrev(prev));
        }
    }

    void markers(BoundaryMarkers newMarkers) {
        this.markers = newMarkers;
    }

    void observe(String value) {
        this.observedValue = value;
    }

    StateGraph build() {
        return new StateGraph(source.variant(), elements, markers, source.capacity(), source.stepIndex(),
                touched, edgeCase, observedValue, nextOrdinal);
    }

    /**
     * Returns the source contents unchanged, tagged with an edge-case marker.
     */
    StateGraph unchanged(EdgeCase marker) {
        return new StateGraph(source.variant(), source.elements(), source.markers(), source.capacity(),
                source.stepIndex(), touched, marker, observedValue, source.nextOrdinal());
    }

    StateGraph buildWith(EdgeCase marker) {
        this.edgeCase = marker;
        return build();
    }
}
