package org.structura.runtime.model;

import java.util.Objects;

/**
 * Opaque, stable identifier of an element inside one structure.
 * Identifiers are ordered by length first so that {@code n2} sorts before {@code n10}.
 *
 * @param value The textual form of the identifier.
 */
public record ElementId(String value) implements Comparable<ElementId> {

    public ElementId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Element id must not be blank");
        }
    }

    /**
     * Creates an identifier from a prefix and an allocation ordinal.
     * @param prefix The id prefix.
     * @param ordinal The ordinal.
     * @return The identifier.
     */
    public static ElementId of(String prefix, long ordinal) {
        return new ElementId(prefix + ordinal);
    }

    @Override
    public int compareTo(ElementId other) {
        int byLength = Integer.compare(value.length(), other.value.length());
        return byLength != 0 ? byLength : value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
