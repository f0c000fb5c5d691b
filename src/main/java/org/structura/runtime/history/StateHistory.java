package org.structura.runtime.history;

import org.structura.runtime.api.NavigationException;
import org.structura.runtime.model.StateGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered record of committed snapshots. Position {@code i} holds the state after {@code i}
 * applied steps; position 0 is the initial state.
 * <p>
 * Snapshots are immutable, so handing out the stored instance is safe and every lookup of the
 * same position returns the same content. Appends only ever extend the end; the single
 * exception is {@link #truncateTo(int)}, used by reset.
 * <p>
 * This class is not thread-safe; the owning engine serializes access.
 */
public class StateHistory {

    private final List<StateGraph> snapshots = new ArrayList<>();

    /**
     * Appends a committed snapshot.
     *
     * @param snapshot The snapshot; its {@code stepIndex} must equal the current size.
     * @throws IllegalArgumentException if the snapshot is positioned elsewhere.
     */
    public void append(StateGraph snapshot) {
        if (snapshot.stepIndex() != snapshots.size()) {
            throw new IllegalArgumentException("Snapshot for index " + snapshot.stepIndex()
                    + " cannot be appended at position " + snapshots.size());
        }
        snapshots.add(snapshot);
    }

    /**
     * Returns the snapshot at a position.
     *
     * @param index The history position.
     * @return The snapshot.
     * @throws NavigationException if the position is not committed.
     */
    public StateGraph get(int index) throws NavigationException {
        if (index < 0 || index >= snapshots.size()) {
            throw new NavigationException("History index " + index + " outside committed range [0, " + (snapshots.size() - 1) + "]");
        }
        return snapshots.get(index);
    }

    /**
     * @return the most recent snapshot.
     * @throws IllegalStateException if nothing has been committed.
     */
    public StateGraph latest() {
        if (snapshots.isEmpty()) {
            throw new IllegalStateException("History is empty");
        }
        return snapshots.get(snapshots.size() - 1);
    }

    /**
     * Drops every snapshot after {@code index}.
     *
     * @param index The last position to keep.
     */
    public void truncateTo(int index) {
        if (index < 0 || index >= snapshots.size()) {
            throw new IllegalArgumentException("Cannot truncate to " + index + " in a history of " + snapshots.size());
        }
        snapshots.subList(index + 1, snapshots.size()).clear();
    }

    public void clear() {
        snapshots.clear();
    }

    public int size() {
        return snapshots.size();
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    /**
     * @return an unmodifiable copy of all snapshots, oldest first.
     */
    public List<StateGraph> snapshots() {
        return Collections.unmodifiableList(new ArrayList<>(snapshots));
    }
}
