package org.structura.cli.rendering;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.structura.runtime.RejectionRecord;
import org.structura.runtime.StateTransitionResult;
import org.structura.runtime.model.BoundaryMarkers;
import org.structura.runtime.model.BoundaryMarkers.ArrayMarkers;
import org.structura.runtime.model.BoundaryMarkers.ListMarkers;
import org.structura.runtime.model.BoundaryMarkers.QueueMarkers;
import org.structura.runtime.model.BoundaryMarkers.StackMarkers;
import org.structura.runtime.model.Element;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.validation.StructuralViolation;

import java.util.Collection;

/**
 * Renders snapshots and step outcomes as JSON for renderers and the command line.
 * Element ids are written as plain strings, absent links as JSON null.
 */
public class SnapshotJson {

    private final ObjectMapper mapper;
    private final boolean pretty;

    public SnapshotJson(boolean pretty) {
        this.mapper = new ObjectMapper();
        this.pretty = pretty;
    }

    /**
     * Builds the JSON tree of a snapshot.
     *
     * @param state The snapshot.
     * @return The tree.
     */
    public ObjectNode snapshot(StateGraph state) {
        ObjectNode node = mapper.createObjectNode();
        node.put("stepIndex", state.stepIndex());
        node.put("variant", state.variant().name());
        if (state.capacity() != null) {
            node.put("capacity", state.capacity());
        } else {
            node.putNull("capacity");
        }
        node.set("markers", markers(state.markers()));

        ArrayNode values = node.putArray("values");
        state.orderedValues().forEach(values::add);

        ArrayNode elements = node.putArray("elements");
        for (Element e : state.elements().values()) {
            ObjectNode element = elements.addObject();
            element.put("id", e.id().value());
            element.put("value", e.value());
            if (state.variant().isLinked()) {
                putId(element, "next", e.next());
                putId(element, "prev", e.prev());
            } else {
                element.put("slot", e.slot());
            }
        }
        node.set("modified", ids(state.modifiedElementIds()));
        putText(node, "edgeCase", state.edgeCase() != null ? state.edgeCase().name() : null);
        putText(node, "observedValue", state.observedValue());
        return node;
    }

    /**
     * Builds the JSON tree of a step outcome. Committed results embed the new snapshot,
     * rejections embed their violations.
     *
     * @param result The outcome.
     * @return The tree.
     */
    public ObjectNode result(StateTransitionResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("stepIndex", result.stepIndex());
        node.put("operation", result.step().operationKind().name());
        node.put("success", result.success());
        node.put("invariantsPreserved", result.invariantsPreserved());
        putText(node, "edgeCase", result.edgeCase() != null ? result.edgeCase().name() : null);
        if (result.success()) {
            node.set("state", snapshot(result.newState()));
        } else {
            ArrayNode errors = node.putArray("errors");
            for (StructuralViolation v : result.errors()) {
                ObjectNode error = errors.addObject();
                error.put("kind", v.kind().name());
                error.put("invariant", v.invariant().name());
                error.put("reason", v.reason());
                error.set("offendingIds", ids(v.offendingIds()));
            }
        }
        return node;
    }

    /**
     * @param rejection A logged rejection.
     * @return its JSON tree.
     */
    public ObjectNode rejection(RejectionRecord rejection) {
        ObjectNode node = mapper.createObjectNode();
        node.put("stepIndex", rejection.stepIndex());
        node.put("operation", rejection.operationKind().name());
        ArrayNode violated = node.putArray("violated");
        rejection.violated().forEach(name -> violated.add(name.name()));
        node.set("offendingIds", ids(rejection.offendingIds()));
        ArrayNode reasons = node.putArray("reasons");
        rejection.reasons().forEach(reasons::add);
        return node;
    }

    /**
     * Serializes a tree with the configured layout.
     *
     * @param node The tree.
     * @return The JSON text.
     */
    public String write(ObjectNode node) {
        try {
            return pretty
                ? mapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(node)
                : mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // a tree built from strings and numbers always serializes
            throw new IllegalStateException("Cannot serialize snapshot JSON", e);
        }
    }

    private ObjectNode markers(BoundaryMarkers markers) {
        ObjectNode node = mapper.createObjectNode();
        if (markers instanceof ListMarkers list) {
            putId(node, "head", list.head());
            putId(node, "tail", list.tail());
            node.put("size", list.size());
        } else if (markers instanceof ArrayMarkers array) {
            node.put("size", array.size());
        } else if (markers instanceof StackMarkers stack) {
            node.put("top", stack.top());
        } else if (markers instanceof QueueMarkers queue) {
            node.put("front", queue.front());
            node.put("rear", queue.rear());
            node.put("size", queue.size());
        }
        return node;
    }

    private ArrayNode ids(Collection<ElementId> ids) {
        ArrayNode array = mapper.createArrayNode();
        ids.forEach(id -> array.add(id.value()));
        return array;
    }

    private static void putId(ObjectNode node, String field, ElementId id) {
        putText(node, field, id != null ? id.value() : null);
    }

    private static void putText(ObjectNode node, String field, String text) {
        if (text != null) {
            node.put(field, text);
        } else {
            node.putNull(field);
        }
    }
}
