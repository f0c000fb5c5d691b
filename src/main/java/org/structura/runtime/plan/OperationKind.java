package org.structura.runtime.plan;

import org.structura.runtime.Config;
import org.structura.runtime.model.StructureVariant;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.structura.runtime.model.StructureVariant.*;

/**
 * Every operation a plan step may request, with the variants that accept it and the parameters
 * it needs.
 */
public enum OperationKind {
    INSERT_HEAD(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_VALUE),
    INSERT_TAIL(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_VALUE),
    INSERT_AT(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_POSITION, Config.PARAM_VALUE),
    DELETE_HEAD(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED)),
    DELETE_TAIL(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED)),
    DELETE_AT(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_POSITION),
    DELETE_BY_VALUE(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_VALUE),
    UPDATE_AT(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_POSITION, Config.PARAM_VALUE),
    PUSH(EnumSet.of(STACK), Config.PARAM_VALUE),
    POP(EnumSet.of(STACK)),
    PEEK(EnumSet.of(STACK, QUEUE)),
    ENQUEUE(EnumSet.of(QUEUE), Config.PARAM_VALUE),
    DEQUEUE(EnumSet.of(QUEUE)),
    TRAVERSE(EnumSet.allOf(StructureVariant.class)),
    ACCESS(EnumSet.of(ARRAY, SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_POSITION),
    SEARCH(EnumSet.allOf(StructureVariant.class), Config.PARAM_VALUE),
    REVERSE(EnumSet.of(SINGLY_LINKED, DOUBLY_LINKED)),
    SET_NEXT(EnumSet.of(SINGLY_LINKED, DOUBLY_LINKED), Config.PARAM_FROM, Config.PARAM_TO),
    SET_PREV(EnumSet.of(DOUBLY_LINKED), Config.PARAM_FROM, Config.PARAM_TO);

    private final Set<StructureVariant> variants;
    private final List<String> requiredParameters;

    OperationKind(EnumSet<StructureVariant> variants, String... requiredParameters) {
        this.variants = Collections.unmodifiableSet(variants);
        this.requiredParameters = List.of(requiredParameters);
    }

    /**
     * @param variant The structure shape.
     * @return true if steps of this kind may run on the variant.
     */
    public boolean supports(StructureVariant variant) {
        return variants.contains(variant);
    }

    /**
     * @return the parameter keys a step of this kind must provide.
     */
    public List<String> requiredParameters() {
        return requiredParameters;
    }

    /**
     * @return true if the operation only reads the structure.
     */
    public boolean isReadOnly() {
        return this == PEEK || this == TRAVERSE || this == ACCESS || this == SEARCH;
    }
}
