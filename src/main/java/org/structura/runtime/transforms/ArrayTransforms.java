package org.structura.runtime.transforms;

import org.structura.runtime.model.BoundaryMarkers.ArrayMarkers;
import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.plan.Step;

import java.util.List;

/**
 * Insert, delete and update on a fixed-capacity array. Inserts and deletes shift the tail of the
 * used region by one slot; every shifted element counts as modified.
 */
final class ArrayTransforms {

    private ArrayTransforms() {}

    static void registerAll(TransformRegistry registry) {
        StructureVariant v = StructureVariant.ARRAY;
        registry.register(v, OperationKind.INSERT_HEAD, (editor, step) -> insertAt(editor, 0, step.value()))
                .register(v, OperationKind.INSERT_TAIL, (editor, step) -> insertAt(editor, size(editor), step.value()))
                .register(v, OperationKind.INSERT_AT, (editor, step) -> insertAt(editor, step.position(), step.value()))
                .register(v, OperationKind.DELETE_HEAD, (editor, step) -> size(editor) == 0
                        ? editor.unchanged(EdgeCase.UNDERFLOW)
                        : deleteAt(editor, 0))
                .register(v, OperationKind.DELETE_TAIL, (editor, step) -> size(editor) == 0
                        ? editor.unchanged(EdgeCase.UNDERFLOW)
                        : deleteAt(editor, size(editor) - 1))
                .register(v, OperationKind.DELETE_AT, (editor, step) -> deleteAt(editor, step.position()))
                .register(v, OperationKind.DELETE_BY_VALUE, ArrayTransforms::deleteByValue)
                .register(v, OperationKind.UPDATE_AT, (editor, step) -> updateAt(editor, step.position(), step.value()));
    }

    private static int size(StateEditor editor) {
        return editor.current().markersAs(ArrayMarkers.class).size();
    }

    static StateGraph insertAt(StateEditor editor, int position, String value) {
        int size = size(editor);
        if (position < 0 || position > size) {
            return editor.unchanged(EdgeCase.OUT_OF_BOUNDS);
        }
        if (size >= editor.current().capacity()) {
            return editor.unchanged(EdgeCase.OVERFLOW);
        }
        List<Element> ordered = editor.current().orderedElements();
        for (int i = size - 1; i >= position; i--) {
            Element shifted = ordered.get(i);
            editor.put(shifted.withSlot(shifted.slot() + 1));
        }
        editor.create(id -> Element.slotted(id, value, position));
        editor.markers(new ArrayMarkers(size + 1));
        return editor.build();
    }

    static StateGraph deleteAt(StateEditor editor, int position) {
        int size = size(editor);
        if (position < 0 || position >= size) {
            return editor.unchanged(EdgeCase.OUT_OF_BOUNDS);
        }
        List<Element> ordered = editor.current().orderedElements();
        Element removed = ordered.get(position);
        editor.remove(removed.id());
        for (int i = position + 1; i < size; i++) {
            Element shifted = ordered.get(i);
            editor.put(shifted.withSlot(shifted.slot() - 1));
        }
        editor.observe(removed.value());
        editor.markers(new ArrayMarkers(size - 1));
        return editor.build();
    }

    private static StateGraph deleteByValue(StateEditor editor, Step step) {
        List<Element> ordered = editor.current().orderedElements();
        for (int i = 0; i < ordered.size(); i++) {
            if (step.value().equals(ordered.get(i).value())) {
                return deleteAt(editor, i);
            }
        }
        return editor.unchanged(EdgeCase.NOT_FOUND);
    }

    private static StateGraph updateAt(StateEditor editor, int position, String value) {
        int size = size(editor);
        if (position < 0 || position >= size) {
            return editor.unchanged(EdgeCase.OUT_OF_BOUNDS);
        }
        Element target = editor.current().orderedElements().get(position);
        editor.put(target.withValue(value));
        editor.observe(target.value());
        return editor.build();
    }
}
