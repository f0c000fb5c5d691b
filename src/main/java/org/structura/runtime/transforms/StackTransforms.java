package org.structura.runtime.transforms;

import org.structura.runtime.Config;
import org.structura.runtime.model.BoundaryMarkers.StackMarkers;
import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.plan.Step;

/**
 * PUSH and POP on an array-backed stack. Slot {@code top} holds the most recent push.
 */
final class StackTransforms {

    private StackTransforms() {}

    static void registerAll(TransformRegistry registry) {
        registry.register(StructureVariant.STACK, OperationKind.PUSH, StackTransforms::push)
                .register(StructureVariant.STACK, OperationKind.POP, StackTransforms::pop);
    }

    private static StateGraph push(StateEditor editor, Step step) {
        int top = editor.current().markersAs(StackMarkers.class).top();
        if (top + 1 >= editor.current().capacity()) {
            return editor.unchanged(EdgeCase.OVERFLOW);
        }
        editor.create(id -> Element.slotted(id, step.value(), top + 1));
        editor.markers(new StackMarkers(top + 1));
        return editor.build();
    }

    private static StateGraph pop(StateEditor editor, Step step) {
        int top = editor.current().markersAs(StackMarkers.class).top();
        if (top == Config.EMPTY_STACK_TOP) {
            return editor.unchanged(EdgeCase.UNDERFLOW);
        }
        Element popped = editor.atSlot(top);
        editor.remove(popped.id());
        editor.observe(popped.value());
        editor.markers(new StackMarkers(top - 1));
        return editor.build();
    }
}
