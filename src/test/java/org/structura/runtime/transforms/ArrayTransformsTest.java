package org.structura.runtime.transforms;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.structura.runtime.model.BoundaryMarkers.ArrayMarkers;
import org.structura.runtime.model.EdgeCase;
import org.structura.runtime.model.ElementId;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;
import org.structura.runtime.plan.OperationKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.structura.runtime.transforms.TransformFixtures.apply;
import static org.structura.runtime.transforms.TransformFixtures.position;
import static org.structura.runtime.transforms.TransformFixtures.positionValue;
import static org.structura.runtime.transforms.TransformFixtures.state;
import static org.structura.runtime.transforms.TransformFixtures.value;

@Tag("unit")
class ArrayTransformsTest {

    private final StateGraph abc = state(StructureVariant.ARRAY, 5, "a", "b", "c");

    @Test
    void insertShiftsTheTailOfTheUsedRegion() {
        StateGraph result = apply(abc, OperationKind.INSERT_AT, positionValue(1, "x"));

        assertThat(result.orderedValues()).containsExactly("a", "x", "b", "c");
        assertThat(result.markersAs(ArrayMarkers.class).size()).isEqualTo(4);
        // shifted b and c plus the new element
        assertThat(result.modifiedElementIds()).containsExactly(new ElementId("n1"), new ElementId("n2"), new ElementId("n3"));
        assertThat(result.edgeCase()).isNull();
    }

    @Test
    void deleteClosesTheGapAndReportsRemovedValue() {
        StateGraph result = apply(abc, OperationKind.DELETE_HEAD);

        assertThat(result.orderedValues()).containsExactly("b", "c");
        assertThat(result.element(new ElementId("n1")).slot()).isZero();
        assertThat(result.observedValue()).isEqualTo("a");
    }

    @Test
    void updateKeepsIdentityAndReportsOldValue() {
        StateGraph result = apply(abc, OperationKind.UPDATE_AT, positionValue(2, "z"));

        assertThat(result.orderedValues()).containsExactly("a", "b", "z");
        assertThat(result.element(new ElementId("n2")).value()).isEqualTo("z");
        assertThat(result.observedValue()).isEqualTo("c");
        assertThat(result.modifiedElementIds()).containsExactly(new ElementId("n2"));
    }

    @Test
    void edgeCasesLeaveContentsUntouched() {
        StateGraph full = state(StructureVariant.ARRAY, 2, "a", "b");
        StateGraph empty = state(StructureVariant.ARRAY, 2);

        assertThat(apply(full, OperationKind.INSERT_TAIL, value("c")).edgeCase()).isEqualTo(EdgeCase.OVERFLOW);
        assertThat(apply(empty, OperationKind.DELETE_TAIL).edgeCase()).isEqualTo(EdgeCase.UNDERFLOW);
        assertThat(apply(full, OperationKind.DELETE_AT, position(2)).edgeCase()).isEqualTo(EdgeCase.OUT_OF_BOUNDS);
        StateGraph missing = apply(full, OperationKind.DELETE_BY_VALUE, value("q"));
        assertThat(missing.edgeCase()).isEqualTo(EdgeCase.NOT_FOUND);
        assertThat(missing.elements()).isEqualTo(full.elements());
    }

    @Test
    void sourceSnapshotIsNeverMutated() {
        apply(abc, OperationKind.DELETE_AT, position(1));

        assertThat(abc.orderedValues()).containsExactly("a", "b", "c");
        assertThat(abc.markersAs(ArrayMarkers.class).size()).isEqualTo(3);
    }
}
