package org.structura.runtime.model;

import org.structura.runtime.Config;

import java.util.Objects;

/**
 * One entry in a structure's element mapping. Links are identifiers, never references.
 *
 * @param id The identifier of this element.
 * @param value The stored value.
 * @param slot Physical position for array, stack and queue elements; {@link Config#NO_SLOT} for list nodes.
 * @param next Identifier of the successor, or null.
 * @param prev Identifier of the predecessor (doubly linked lists only), or null.
 */
public record Element(ElementId id, String value, int slot, ElementId next, ElementId prev) {

    public Element {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Creates an element stored in a physical slot.
     */
    public static Element slotted(ElementId id, String value, int slot) {
        return new Element(id, value, slot, null, null);
    }

    /**
     * Creates an unlinked list node.
     */
    public static Element node(ElementId id, String value) {
        return new Element(id, value, Config.NO_SLOT, null, null);
    }

    public Element withValue(String newValue) {
        return new Element(id, newValue, slot, next, prev);
    }

    public Element withSlot(int newSlot) {
        return new Element(id, value, newSlot, next, prev);
    }

    public Element withNext(ElementId newNext) {
        return new Element(id, value, slot, newNext, prev);
    }

    public Element withPrev(ElementId newPrev) {
        return new Element(id, value, slot, next, newPrev);
    }
}
