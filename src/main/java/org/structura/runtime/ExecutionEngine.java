package org.structura.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.structura.runtime.api.ConfigurationException;
import org.structura.runtime.api.NavigationException;
import org.structura.runtime.api.SchemaException;
import org.structura.runtime.api.SequenceException;
import org.structura.runtime.history.StateHistory;
import org.structura.runtime.model.StateGraph;
import org.structura.runtime.model.StructureFactory;
import org.structura.runtime.plan.ExecutionPlan;
import org.structura.runtime.plan.PlanSchemaValidator;
import org.structura.runtime.plan.Step;
import org.structura.runtime.transforms.TransformRegistry;
import org.structura.runtime.validation.InvariantValidator;
import org.structura.runtime.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Applies the steps of one plan to one structure, one at a time.
 * <p>
 * Each step runs through three phases: the registered transform builds a candidate from the
 * current committed state, the {@link InvariantValidator} judges it, and the engine either
 * appends it to the {@link StateHistory} or records a rejection. Nothing else changes engine
 * state, so a step either commits completely or has no observable effect.
 * <p>
 * Mutations ({@link #initialize}, {@link #applyStep}, {@link #reset}) hold the write lock;
 * reads hold the read lock and therefore never observe a step half-way through.
 * An engine belongs to one learner session and is never shared between sessions.
 */
public class ExecutionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);

    private final InvariantValidator validator;
    private final TransformRegistry transforms;
    private final StructureFactory structureFactory;
    private final PlanSchemaValidator schemaValidator;
    private final StateHistory history = new StateHistory();
    private final List<RejectionRecord> rejections = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private ExecutionPlan plan;

    /**
     * Creates an engine with the built-in defaults.
     */
    public ExecutionEngine() {
        this(EngineOptions.defaults());
    }

    /**
     * Creates an engine with the given options and the standard transforms.
     * @param options The engine options.
     */
    public ExecutionEngine(EngineOptions options) {
        this(options, new InvariantValidator(), TransformRegistry.standard(options.idPrefix()));
    }

    /**
     * Creates an engine with explicit collaborators.
     * @param options The engine options.
     * @param validator The validator judging every candidate.
     * @param transforms The transform registry.
     */
    public ExecutionEngine(EngineOptions options, InvariantValidator validator, TransformRegistry transforms) {
        this.validator = validator;
        this.transforms = transforms;
        this.structureFactory = new StructureFactory(options, validator);
        this.schemaValidator = new PlanSchemaValidator(options);
    }

    /**
     * Loads a plan and commits its initial state as history index 0. Any previous plan and
     * history are discarded, but only once the new plan has been accepted.
     *
     * @param executionPlan The plan.
     * @throws SchemaException if the plan is malformed.
     * @throws ConfigurationException if the initial configuration is malformed.
     */
    public void initialize(ExecutionPlan executionPlan) throws SchemaException, ConfigurationException {
        lock.writeLock().lock();
        try {
            schemaValidator.validate(executionPlan);
            StateGraph initial = structureFactory.build(executionPlan.initialConfiguration());

            history.clear();
            history.append(initial);
            rejections.clear();
            this.plan = executionPlan;
            LOG.info("Initialized plan '{}': {} with {} element(s), {} step(s)",
                    executionPlan.planId(), initial.variant(), initial.size(), executionPlan.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies one plan step to the current committed state.
     *
     * @param stepIndex Plan index of the step; must be the next unapplied step.
     * @return The commit or rejection outcome.
     * @throws SequenceException if the step is not the next one, or the plan has no such step.
     * @throws IllegalStateException if no plan has been initialized.
     */
    public StateTransitionResult applyStep(int stepIndex) throws SequenceException {
        lock.writeLock().lock();
        try {
            requireInitialized();
            if (stepIndex < 0 || stepIndex >= plan.size()) {
                throw new SequenceException("Plan '" + plan.planId() + "' has no step " + stepIndex
                        + " (steps 0.." + (plan.size() - 1) + ")");
            }
            int expected = history.size() - 1;
            if (stepIndex != expected) {
                throw new SequenceException("Step " + stepIndex + " applied out of order; next step is " + expected);
            }

            Step step = plan.step(stepIndex);
            StateGraph current = history.latest();
            StateGraph candidate = transforms.apply(current, step);
            ValidationResult validation = validator.check(candidate);

            if (!validation.valid()) {
                RejectionRecord rejection = new RejectionRecord(stepIndex, step.operationKind(),
                        validation.violated(), validation.offendingIds(), validation.reasons());
                rejections.add(rejection);
                LOG.warn("Plan '{}' step {} ({}) rejected: violated {} offending {} {}",
                        plan.planId(), stepIndex, step.operationKind(), rejection.violated(),
                        rejection.offendingIds(), rejection.reasons());
                return StateTransitionResult.rejected(step, candidate, validation);
            }

            StateGraph committed = candidate.atStepIndex(history.size());
            history.append(committed);
            LOG.debug("Plan '{}' step {} ({}) committed as index {} modified={} edgeCase={}",
                    plan.planId(), stepIndex, step.operationKind(), committed.stepIndex(),
                    committed.modifiedElementIds(), committed.edgeCase());
            return StateTransitionResult.committed(step, committed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies the next unapplied step, if any.
     *
     * @return The outcome, or empty when every step has been committed.
     */
    public Optional<StateTransitionResult> applyNext() {
        lock.writeLock().lock();
        try {
            requireInitialized();
            int next = history.size() - 1;
            if (next >= plan.size()) {
                return Optional.empty();
            }
            return Optional.of(applyStep(next));
        } catch (SequenceException e) {
            // next is computed under the same write lock, so applyStep cannot disagree with it
            throw new IllegalStateException("Engine sequence out of sync", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies the remaining steps in order and stops after the first rejection.
     *
     * @return The outcomes, in order.
     */
    public List<StateTransitionResult> runToEnd() {
        lock.writeLock().lock();
        try {
            List<StateTransitionResult> results = new ArrayList<>();
            Optional<StateTransitionResult> next;
            while ((next = applyNext()).isPresent()) {
                results.add(next.get());
                if (!next.get().success()) {
                    break;
                }
            }
            return results;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the most recently committed snapshot.
     * @throws IllegalStateException if no plan has been initialized.
     */
    public StateGraph getCurrentState() {
        lock.readLock().lock();
        try {
            requireInitialized();
            return history.latest();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a committed snapshot without re-running any transform.
     *
     * @param index History index (0 = initial state).
     * @return The snapshot.
     * @throws NavigationException if the index is outside the committed history.
     */
    public StateGraph goToStep(int index) throws NavigationException {
        lock.readLock().lock();
        try {
            requireInitialized();
            return history.get(index);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Truncates history back to the initial state and clears the rejection log.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            requireInitialized();
            history.truncateTo(0);
            rejections.clear();
            LOG.info("Plan '{}' reset to its initial state", plan.planId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the number of committed snapshots, including the initial state.
     */
    public int historySize() {
        lock.readLock().lock();
        try {
            return history.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the plan index of the next step to apply; equals the plan size when done.
     */
    public int nextStepIndex() {
        lock.readLock().lock();
        try {
            requireInitialized();
            return history.size() - 1;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return true if at least one step has not been committed yet.
     */
    public boolean hasNextStep() {
        lock.readLock().lock();
        try {
            return plan != null && history.size() - 1 < plan.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the rejections since the last initialize or reset, oldest first.
     */
    public List<RejectionRecord> getRejections() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(rejections));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the loaded plan, or null before the first initialize.
     */
    public ExecutionPlan getPlan() {
        lock.readLock().lock();
        try {
            return plan;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void requireInitialized() {
        if (plan == null) {
            throw new IllegalStateException("Engine has not been initialized with a plan");
        }
    }
}
