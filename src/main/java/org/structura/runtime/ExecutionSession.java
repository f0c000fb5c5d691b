package org.structura.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.structura.runtime.api.ConfigurationException;
import org.structura.runtime.api.NavigationException;
import org.structura.runtime.api.SchemaException;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.plan.ExecutionPlan;

import java.util.Optional;
import java.util.UUID;

/**
 * One learner's walk through one plan.
 * <p>
 * The session owns its own {@link ExecutionEngine} and a cursor into committed history. Moving
 * forward re-reads history while the cursor is behind the latest commit and only applies a new
 * plan step once it is at the end, so stepping back and forth never re-runs a transform.
 * Sessions are independent of each other; nothing here is static.
 */
public class ExecutionSession {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionSession.class);

    private final String sessionId;
    private final ExecutionEngine engine;
    private int cursor;
    private StateTransitionResult lastResult;

    /**
     * Creates a session with a random id and a default engine.
     */
    public ExecutionSession() {
        this(UUID.randomUUID().toString(), new ExecutionEngine());
    }

    /**
     * @param sessionId Identifier used in log lines.
     * @param engine The engine this session drives exclusively.
     */
    public ExecutionSession(String sessionId, ExecutionEngine engine) {
        this.sessionId = sessionId;
        this.engine = engine;
    }

    /**
     * Loads a plan and places the cursor on the initial state.
     *
     * @param plan The plan.
     * @return The initial snapshot.
     * @throws SchemaException if the plan is malformed.
     * @throws ConfigurationException if the initial configuration is malformed.
     */
    public StateGraph open(ExecutionPlan plan) throws SchemaException, ConfigurationException {
        engine.initialize(plan);
        cursor = 0;
        lastResult = null;
        LOG.debug("Session {} opened plan '{}'", sessionId, plan.planId());
        return engine.getCurrentState();
    }

    /**
     * Moves one position forward.
     * <p>
     * Behind the latest commit this only moves the cursor. At the end of history it applies the
     * next plan step; a commit advances the cursor, a rejection leaves it where it is and is
     * available from {@link #lastResult()}. When the plan is exhausted nothing changes.
     *
     * @return The snapshot under the cursor afterwards.
     */
    public StateGraph stepForward() {
        requireOpen();
        if (cursor < engine.historySize() - 1) {
            cursor++;
            return snapshotAtCursor();
        }
        Optional<StateTransitionResult> result = engine.applyNext();
        if (result.isPresent()) {
            lastResult = result.get();
            if (lastResult.success()) {
                cursor = lastResult.newState().stepIndex();
            }
        }
        return snapshotAtCursor();
    }

    /**
     * Moves one position back; stays on the initial state when already there.
     *
     * @return The snapshot under the cursor afterwards.
     */
    public StateGraph stepBackward() {
        requireOpen();
        if (cursor > 0) {
            cursor--;
        }
        return snapshotAtCursor();
    }

    /**
     * Moves the cursor to any committed position.
     *
     * @param index History index.
     * @return The snapshot at that position.
     * @throws NavigationException if the position has not been committed.
     */
    public StateGraph jumpTo(int index) throws NavigationException {
        requireOpen();
        StateGraph snapshot = engine.goToStep(index);
        cursor = index;
        return snapshot;
    }

    /**
     * @return the snapshot under the cursor.
     */
    public StateGraph current() {
        requireOpen();
        return snapshotAtCursor();
    }

    /**
     * Resets the engine to the initial state and moves the cursor there.
     *
     * @return The initial snapshot.
     */
    public StateGraph restart() {
        requireOpen();
        engine.reset();
        cursor = 0;
        lastResult = null;
        return snapshotAtCursor();
    }

    /**
     * @return the outcome of the most recent step this session applied, if any.
     */
    public Optional<StateTransitionResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    public int cursor() {
        return cursor;
    }

    public String sessionId() {
        return sessionId;
    }

    public ExecutionEngine engine() {
        return engine;
    }

    private StateGraph snapshotAtCursor() {
        try {
            return engine.goToStep(cursor);
        } catch (NavigationException e) {
            // the cursor only ever points at committed positions
            throw new IllegalStateException("Session " + sessionId + " cursor " + cursor + " is outside history", e);
        }
    }

    private void requireOpen() {
        if (engine.getPlan() == null) {
            throw new IllegalStateException("Session " + sessionId + " has no open plan");
        }
    }
}
