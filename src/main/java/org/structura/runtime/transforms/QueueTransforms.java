package org.structura.runtime.transforms;

import org.structura.runtime.model.BoundaryMarkers.QueueMarkers;
import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;
import org.structura.runtime.plan.Step;

/**
 * ENQUEUE and DEQUEUE on a circular buffer: enqueue writes at {@code rear}, dequeue removes at
 * {@code front}, both pointers advance modulo capacity.
 */
final class QueueTransforms {

    private QueueTransforms() {}

    static void registerAll(TransformRegistry registry) {
        registry.register(StructureVariant.QUEUE, OperationKind.ENQUEUE, QueueTransforms::enqueue)
                .register(StructureVariant.QUEUE, OperationKind.DEQUEUE, QueueTransforms::dequeue);
    }

    private static StateGraph enqueue(StateEditor editor, Step step) {
        QueueMarkers m = editor.current().markersAs(QueueMarkers.class);
        int capacity = editor.current().capacity();
        if (m.size() >= capacity) {
            return editor.unchanged(EdgeCase.OVERFLOW);
        }
        editor.create(id -> Element.slotted(id, step.value(), m.rear()));
        editor.markers(new QueueMarkers(m.front(), (m.rear() + 1) % capacity, m.size() + 1));
        return editor.build();
    }

    private static StateGraph dequeue(StateEditor editor, Step step) {
        QueueMarkers m = editor.current().markersAs(QueueMarkers.class);
        if (m.size() == 0) {
            return editor.unchanged(EdgeCase.UNDERFLOW);
        }
        int capacity = editor.current().capacity();
        Element removed = editor.atSlot(m.front());
        editor.remove(removed.id());
        editor.observe(removed.value());
        editor.markers(new QueueMarkers((m.front() + 1) % capacity, m.rear(), m.size() - 1));
        return editor.build();
    }
}
