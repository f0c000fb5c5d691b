package org.structura.runtime.transforms;

import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.plan.Step;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only operations. They leave the structure as it is and report the elements they looked
 * at, so a renderer can highlight them, plus the value read.
 */
final class ReadTransforms {

    private ReadTransforms() {}

    static void registerAll(TransformRegistry registry) {
        for (StructureVariant v : StructureVariant.values()) {
            registry.register(v, OperationKind.TRAVERSE, ReadTransforms::traverse)
                    .register(v, OperationKind.SEARCH, ReadTransforms::search);
            if (OperationKind.ACCESS.supports(v)) {
                registry.register(v, OperationKind.ACCESS, ReadTransforms::access);
            }
            if (OperationKind.PEEK.supports(v)) {
                registry.register(v, OperationKind.PEEK, ReadTransforms::peek);
            }
        }
    }

    private static StateGraph traverse(StateEditor editor, Step step) {
        List<Element> ordered = editor.current().orderedElements();
        if (ordered.isEmpty()) {
            return editor.unchanged(EdgeCase.EMPTY);
        }
        ordered.forEach(e -> editor.read(e.id()));
        editor.observe(ordered.stream().map(Element::value).collect(Collectors.joining(" -> ")));
        return editor.build();
    }

    private static StateGraph search(StateEditor editor, Step step) {
        List<Element> ordered = editor.current().orderedElements();
        for (int i = 0; i < ordered.size(); i++) {
            Element e = ordered.get(i);
            editor.read(e.id());
            if (step.value().equals(e.value())) {
                editor.observe(Integer.toString(i));
                return editor.build();
            }
        }
        return editor.unchanged(EdgeCase.NOT_FOUND);
    }

    private static StateGraph access(StateEditor editor, Step step) {
        List<Element> ordered = editor.current().orderedElements();
        int position = step.position();
        if (position < 0 || position >= ordered.size()) {
            return editor.unchanged(EdgeCase.OUT_OF_BOUNDS);
        }
        Element e = ordered.get(position);
        editor.read(e.id());
        editor.observe(e.value());
        return editor.build();
    }

    /**
     * Stack top or queue front.
     */
    private static StateGraph peek(StateEditor editor, Step step) {
        List<Element> ordered = editor.current().orderedElements();
        if (ordered.isEmpty()) {
            return editor.unchanged(EdgeCase.UNDERFLOW);
        }
        Element e = editor.current().variant() == StructureVariant.STACK
                ? ordered.get(ordered.size() - 1)
                : ordered.get(0);
        editor.read(e.id());
        editor.observe(e.value());
        return editor.build();
    }
}
