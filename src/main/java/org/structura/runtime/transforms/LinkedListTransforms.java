package org.structura.runtime.transforms;

import org.structura.runtime.Config;
import org.structura.runtime.model.BoundaryMarkers.ListMarkers;
import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.plan.Step;

import java.util.List;

/**
 * Transforms for singly and doubly linked lists. Nodes live in the identifier-keyed arena; a
 * transform rewires identifiers and records exactly the nodes whose fields changed, plus the
 * node it created or removed.
 */
final class LinkedListTransforms {

    private LinkedListTransforms() {}

    static void registerAll(TransformRegistry registry) {
        for (StructureVariant v : new StructureVariant[]{StructureVariant.SINGLY_LINKED, StructureVariant.DOUBLY_LINKED}) {
            boolean doubly = v == StructureVariant.DOUBLY_LINKED;
            registry.register(v, OperationKind.INSERT_HEAD, (editor, step) -> insertAt(editor, doubly, 0, step.value()))
                    .register(v, OperationKind.INSERT_TAIL, (editor, step) -> insertAt(editor, doubly, markers(editor).size(), step.value()))
                    .register(v, OperationKind.INSERT_AT, (editor, step) -> insertAt(editor, doubly, step.position(), step.value()))
                    .register(v, OperationKind.DELETE_HEAD, (editor, step) -> markers(editor).size() == 0
                            ? editor.unchanged(EdgeCase.UNDERFLOW)
                            : deleteAt(editor, doubly, 0))
                    .register(v, OperationKind.DELETE_TAIL, (editor, step) -> markers(editor).size() == 0
                            ? editor.unchanged(EdgeCase.UNDERFLOW)
                            : deleteAt(editor, doubly, markers(editor).size() - 1))
                    .register(v, OperationKind.DELETE_AT, (editor, step) -> deleteAt(editor, doubly, step.position()))
                    .register(v, OperationKind.DELETE_BY_VALUE, (editor, step) -> deleteByValue(editor, doubly, step))
                    .register(v, OperationKind.UPDATE_AT, LinkedListTransforms::updateAt)
                    .register(v, OperationKind.REVERSE, (editor, step) -> reverse(editor, doubly))
                    .register(v, OperationKind.SET_NEXT, (editor, step) -> relink(editor, step, true));
        }
        registry.register(StructureVariant.DOUBLY_LINKED, OperationKind.SET_PREV, (editor, step) -> relink(editor, step, false));
    }

    private static ListMarkers markers(StateEditor editor) {
        return editor.current().markersAs(ListMarkers.class);
    }

    private static StateGraph insertAt(StateEditor editor, boolean doubly, int position, String value) {
        ListMarkers m = markers(editor);
        if (position < 0 || position > m.size()) {
            return editor.unchanged(EdgeCase.OUT_OF_BOUNDS);
        }
        Integer capacity = editor.current().capacity();
        if (capacity != null && m.size() >= capacity) {
            return editor.unchanged(EdgeCase.OVERFLOW);
        }
        List<Element> ordered = editor.current().orderedElements();
        ElementId pred = position == 0 ? null : ordered.get(position - 1).id();
        ElementId succ = position == m.size() ? null : ordered.get(position).id();

        ElementId created = editor.create(id -> Element.node(id, value)
                .withNext(succ)
                .withPrev(doubly ? pred : null));
        if (pred != null) {
            editor.setNext(pred, created);
        }
        if (doubly && succ != null) {
            editor.setPrev(succ, created);
        }
        editor.markers(new ListMarkers(
                pred == null ? created : m.head(),
                succ == null ? created : m.tail(),
                m.size() + 1));
        return editor.build();
    }

    private static StateGraph deleteAt(StateEditor editor, boolean doubly, int position) {
        ListMarkers m = markers(editor);
        if (position < 0 || position >= m.size()) {
            return editor.unchanged(EdgeCase.OUT_OF_BOUNDS);
        }
        List<Element> ordered = editor.current().orderedElements();
        Element target = ordered.get(position);
        ElementId pred = position == 0 ? null : ordered.get(position - 1).id();
        ElementId succ = target.next();

        editor.remove(target.id());
        if (pred != null) {
            editor.setNext(pred, succ);
        }
        if (doubly && succ != null) {
            editor.setPrev(succ, pred);
        }
        editor.observe(target.value());
        int size = m.size() - 1;
        editor.markers(size == 0
                ? ListMarkers.EMPTY
                : new ListMarkers(pred == null ? succ : m.head(), succ == null ? pred : m.tail(), size));
        return editor.build();
    }

    private static StateGraph deleteByValue(StateEditor editor, boolean doubly, Step step) {
        List<Element> ordered = editor.current().orderedElements();
        for (int i = 0; i < ordered.size(); i++) {
            if (step.value().equals(ordered.get(i).value())) {
                return deleteAt(editor, doubly, i);
            }
        }
        return editor.unchanged(EdgeCase.NOT_FOUND);
    }

    private static StateGraph updateAt(StateEditor editor, Step step) {
        int position = step.position();
        if (position < 0 || position >= markers(editor).size()) {
            return editor.unchanged(EdgeCase.OUT_OF_BOUNDS);
        }
        Element target = editor.current().orderedElements().get(position);
        editor.put(target.withValue(step.value()));
        editor.observe(target.value());
        return editor.build();
    }

    private static StateGraph reverse(StateEditor editor, boolean doubly) {
        ListMarkers m = markers(editor);
        if (m.size() == 0) {
            return editor.unchanged(EdgeCase.EMPTY);
        }
        List<Element> ordered = editor.current().orderedElements();
        for (int i = 0; i < ordered.size(); i++) {
            ElementId id = ordered.get(i).id();
            editor.setNext(id, i == 0 ? null : ordered.get(i - 1).id());
            if (doubly) {
                editor.setPrev(id, i == ordered.size() - 1 ? null : ordered.get(i + 1).id());
            }
        }
        editor.markers(new ListMarkers(m.tail(), m.head(), m.size()));
        return editor.build();
    }

    /**
     * Raw pointer rewrite. The result may well be illegal; that is for the validator to say.
     */
    private static StateGraph relink(StateEditor editor, Step step, boolean forward) {
        ElementId from = resolve(editor, step.parameter(Config.PARAM_FROM));
        String rawTo = step.parameter(Config.PARAM_TO);
        ElementId to = Config.NULL_LINK.equalsIgnoreCase(rawTo.trim()) ? null : resolve(editor, rawTo);
        if (from == null || editor.get(from) == null) {
            return editor.unchanged(EdgeCase.UNKNOWN_ELEMENT);
        }
        if (forward) {
            editor.setNext(from, to);
        } else {
            editor.setPrev(from, to);
        }
        editor.read(from);
        return editor.build();
    }

    private static ElementId resolve(StateEditor editor, String reference) {
        String ref = reference.trim();
        if (Config.REF_HEAD.equalsIgnoreCase(ref)) {
            return markers(editor).head();
        }
        if (Config.REF_TAIL.equalsIgnoreCase(ref)) {
            return markers(editor).tail();
        }
        return new ElementId(ref);
    }
}
