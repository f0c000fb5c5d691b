package org.structura.runtime.history;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.structura.runtime.api.NavigationException;
import org.structura.runtime.model.BoundaryMarkers.ArrayMarkers;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureVariant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StateHistoryTest {

    private static StateGraph at(int index) {
        return new StateGraph(StructureVariant.ARRAY, null, new ArrayMarkers(0), 1, index, null, null, null, 0);
    }

    @Test
    void appendsOnlyAtTheEnd() throws Exception {
        StateHistory history = new StateHistory();
        history.append(at(0));
        history.append(at(1));

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.get(1)).isSameAs(history.latest());
        assertThatThrownBy(() -> history.append(at(5))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupsOutsideRangeThrowNavigationException() {
        StateHistory history = new StateHistory();
        history.append(at(0));

        assertThatThrownBy(() -> history.get(1)).isInstanceOf(NavigationException.class).hasMessageContaining("[0, 0]");
        assertThatThrownBy(() -> history.get(-1)).isInstanceOf(NavigationException.class);
        assertThatThrownBy(new StateHistory()::latest).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void truncateKeepsThePrefix() throws Exception {
        StateHistory history = new StateHistory();
        StateGraph initial = at(0);
        history.append(initial);
        history.append(at(1));
        history.append(at(2));

        history.truncateTo(0);

        assertThat(history.snapshots()).containsExactly(initial);
        history.append(at(1));
        assertThat(history.get(1).stepIndex()).isEqualTo(1);
    }
}
