package com.phillippitts.routineengine.service.engine;

import com.phillippitts.routineengine.config.properties.RoutineStoreProperties;
import com.phillippitts.routineengine.domain.ActionResult;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.RoutineDefinition;
import com.phillippitts.routineengine.domain.RoutineDetail;
import com.phillippitts.routineengine.domain.RoutineExecution;
import com.phillippitts.routineengine.domain.RoutineSummary;
import com.phillippitts.routineengine.domain.RoutineUpdate;
import com.phillippitts.routineengine.exception.ConditionEvaluationException;
import com.phillippitts.routineengine.exception.DisabledRoutineException;
import com.phillippitts.routineengine.exception.RoutineNotFoundException;
import com.phillippitts.routineengine.exception.RoutineStoreException;
import com.phillippitts.routineengine.exception.RoutineValidationException;
import com.phillippitts.routineengine.service.action.ActionDispatcher;
import com.phillippitts.routineengine.service.condition.ConditionEvaluator;
import com.phillippitts.routineengine.service.metrics.RoutineMetricsPublisher;
import com.phillippitts.routineengine.service.store.MemoryRecord;
import com.phillippitts.routineengine.service.store.RoutineRecordCodec;
import com.phillippitts.routineengine.service.store.RoutineRecordStore;
import com.phillippitts.routineengine.service.trigger.TriggerManager;
import com.phillippitts.routineengine.service.trigger.event.RoutineTriggerDroppedEvent;
import com.phillippitts.routineengine.service.trigger.event.RoutineTriggeredEvent;
import com.phillippitts.routineengine.util.IdGenerator;
import com.phillippitts.routineengine.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link RoutineEngine}: CRUD through the record store, trigger registration through the
 * {@link TriggerManager}, and execution through the {@link ConditionEvaluator} and {@link ActionDispatcher}.
 *
 * <p><b>Execution:</b> conditions are evaluated first. An automatic run whose conditions fail returns
 * {@value RoutineExecution#CONDITIONS_NOT_MET} without running actions; a manual run proceeds anyway.
 * After the actions ran, {@code executionCount} is incremented and {@code lastExecuted} set, under a
 * per-routine lock on a fresh read of the record.
 *
 * <p><b>Concurrency:</b> trigger fires hold a per-routine in-flight slot; a fire arriving while the
 * slot is taken is dropped and logged. Manual runs take the slot when free but never wait for it.
 *
 * <p>MDC keys {@code routineId} and {@code executionId} are set for the duration of each execution.
 *
 * @see DefaultRoutineEngineBuilder
 */
public class DefaultRoutineEngine implements RoutineEngine {

    private static final Logger LOG = LogManager.getLogger(DefaultRoutineEngine.class);

    static final String SOURCE_MANUAL = "manual";
    static final String SOURCE_AUTOMATIC = "automatic";

    private final RoutineRecordStore store;
    private final RoutineRecordCodec codec;
    private final RoutineStoreProperties storeProps;
    private final TriggerManager triggers;
    private final ConditionEvaluator conditions;
    private final ActionDispatcher actions;
    private final ApplicationEventPublisher publisher;
    private final RoutineMetricsPublisher metrics;
    private final Clock clock;
    private final IdGenerator executionIds;
    private final RoutineExecutionGuard guard = new RoutineExecutionGuard();

    DefaultRoutineEngine(RoutineRecordStore store,
                         RoutineRecordCodec codec,
                         RoutineStoreProperties storeProps,
                         TriggerManager triggers,
                         ConditionEvaluator conditions,
                         ActionDispatcher actions,
                         ApplicationEventPublisher publisher,
                         RoutineMetricsPublisher metrics,
                         Clock clock,
                         IdGenerator executionIds) {
        this.store = store;
        this.codec = codec;
        this.storeProps = storeProps;
        this.triggers = triggers;
        this.conditions = conditions;
        this.actions = actions;
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
        this.executionIds = executionIds;
    }

    // ---- CRUD ----

    @Override
    public String createRoutine(RoutineDefinition definition) {
        if (definition == null) {
            throw new RoutineValidationException("definition", "Routine definition is required");
        }
        requireText("name", definition.name());
        requireText("description", definition.description());
        if (definition.trigger() == null) {
            throw new RoutineValidationException("trigger", "Routine trigger is required");
        }
        if (definition.actions().isEmpty()) {
            throw new RoutineValidationException("actions", "Routine must have at least one action");
        }

        Routine draft = new Routine(null, definition.name(), definition.description(), definition.trigger(),
                definition.conditions(), definition.actions(), definition.tags(), true, 0L, null,
                clock.instant(), definition.createdFromTask());
        String id = writeNew(draft);
        Routine created = withId(draft, id);
        installTrigger(created);
        LOG.info("Created routine {} '{}' ({})", id, created.name(), created.trigger().describe());
        return id;
    }

    @Override
    public List<RoutineSummary> getRoutines(boolean enabledOnly) {
        return store.getRoutines(enabledOnly).stream()
                .filter(codec::isRoutine)
                .map(codec::fromRecord)
                .filter(r -> !enabledOnly || r.enabled())
                .map(Routine::toSummary)
                .toList();
    }

    @Override
    public Optional<RoutineDetail> getRoutineById(String id) {
        return findRoutine(id).map(Routine::toDetail);
    }

    @Override
    public RoutineDetail requireRoutine(String id) {
        return getRoutineById(id).orElseThrow(() -> new RoutineNotFoundException(id));
    }

    @Override
    public void updateRoutine(String id, RoutineUpdate update) {
        if (update == null) {
            throw new RoutineValidationException("update", "Routine update is required");
        }
        if (update.name() != null) {
            requireText("name", update.name());
        }
        if (update.description() != null) {
            requireText("description", update.description());
        }
        if (update.actions() != null && update.actions().isEmpty()) {
            throw new RoutineValidationException("actions", "Routine must have at least one action");
        }

        requireRecord(id);
        guard.withLock(id, () -> {
            MemoryRecord record = requireRecord(id);
            Routine current = codec.fromRecord(record);
            Routine merged = merge(current, update);
            write(record, merged);

            if (current.enabled() && !merged.enabled()) {
                triggers.deregister(id);
            } else if (merged.enabled()) {
                triggers.deregister(id);
                installTrigger(merged);
            }
            LOG.info("Updated routine {} (enabled={})", id, merged.enabled());
            return null;
        });
    }

    /**
     * The record is already written when this runs; a mechanism that cannot be installed leaves the
     * routine stored without one, which the health check reports.
     */
    private void installTrigger(Routine routine) {
        try {
            triggers.register(routine);
        } catch (RuntimeException e) {
            LOG.warn("Could not install {} trigger for routine {}: {}",
                    routine.trigger().kind().wireName(), routine.id(), e.getMessage(), e);
        }
    }

    @Override
    public void deleteRoutine(String id) {
        requireRecord(id);
        triggers.deregister(id);
        boolean deleted;
        try {
            deleted = store.deleteMemory(id);
        } catch (RoutineStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RoutineStoreException("Failed to delete routine " + id, e);
        }
        if (!deleted) {
            throw new RoutineStoreException("Store refused to delete routine " + id);
        }
        LOG.info("Deleted routine {}", id);
    }

    @Override
    public boolean toggleRoutine(String id) {
        Routine current = findRoutine(id).orElseThrow(() -> new RoutineNotFoundException(id));
        boolean enabled = !current.enabled();
        updateRoutine(id, RoutineUpdate.enabled(enabled));
        return enabled;
    }

    // ---- execution ----

    @Override
    public RoutineExecution executeRoutine(String id, boolean manualTrigger) {
        if (!manualTrigger) {
            return execute(id, false, SOURCE_AUTOMATIC);
        }
        boolean acquired = guard.tryAcquire(id);
        if (!acquired) {
            LOG.info("Manual run of routine {} while an automatic run is in flight", id);
        }
        try {
            return execute(id, true, SOURCE_MANUAL);
        } finally {
            if (acquired) {
                guard.release(id);
            }
        }
    }

    @Override
    @EventListener
    @Async("routineExecutor")
    public void onRoutineTriggered(RoutineTriggeredEvent event) {
        String id = event.routineId();
        if (!guard.tryAcquire(id)) {
            LOG.warn("Dropping {} trigger for routine {}: previous execution still running", event.source(), id);
            metrics.recordDropped(event.source(), "in_flight");
            publisher.publishEvent(new RoutineTriggerDroppedEvent(id, event.source(), clock.instant(), "in_flight"));
            return;
        }
        try {
            RoutineExecution result = execute(id, false, event.source());
            if (result.success()) {
                LOG.info("Routine {} executed by {} trigger ({} action(s))", id, event.source(),
                        result.results() == null ? 0 : result.results().size());
            } else if (result.skippedByConditions()) {
                LOG.info("Routine {} skipped: {}", id, result.error());
            } else {
                LOG.warn("Routine {} failed on {} trigger: {}", id, event.source(), result.error());
            }
        } finally {
            guard.release(id);
        }
    }

    private RoutineExecution execute(String id, boolean manual, String source) {
        String executionId = executionIds.nextId();
        Instant start = clock.instant();
        long startNanos = System.nanoTime();
        Map<String, String> previousContext = ThreadContext.getImmutableContext();
        ThreadContext.put("routineId", String.valueOf(id));
        ThreadContext.put("executionId", executionId);

        RoutineExecution result;
        String failureReason = null;
        try {
            Routine routine = findRoutine(id).orElseThrow(() -> new RoutineNotFoundException(id));
            if (!manual && !routine.enabled()) {
                throw new DisabledRoutineException(id);
            }

            boolean passed = conditions.evaluate(routine.conditions());
            if (!passed && !manual) {
                result = RoutineExecution.failed(id, executionId, start, clock.instant(),
                        RoutineExecution.CONDITIONS_NOT_MET);
            } else {
                if (!passed) {
                    LOG.info("Conditions not met for routine {}, running anyway (manual)", id);
                }
                List<ActionResult> results = actions.run(routine.actions(), routine);
                result = recordRun(id, executionId, start, results);
                if (!result.success()) {
                    failureReason = "store_error";
                }
            }
        } catch (RoutineNotFoundException e) {
            failureReason = "not_found";
            result = RoutineExecution.failed(id, executionId, start, clock.instant(), e.getMessage());
            if (!manual) {
                LOG.warn("Trigger fired for missing routine {}, removing its trigger", id);
                triggers.deregister(id);
                publisher.publishEvent(new RoutineTriggerDroppedEvent(id, source, clock.instant(), "not_found"));
            }
        } catch (DisabledRoutineException e) {
            failureReason = "disabled";
            result = RoutineExecution.failed(id, executionId, start, clock.instant(), e.getMessage());
        } catch (ConditionEvaluationException e) {
            failureReason = "condition_error";
            LOG.warn("Condition evaluation failed for routine {}: {}", id, e.getMessage());
            result = RoutineExecution.failed(id, executionId, start, clock.instant(), e.getMessage());
        } catch (RuntimeException e) {
            failureReason = "error";
            LOG.error("Unexpected error executing routine {}", id, e);
            result = RoutineExecution.failed(id, executionId, start, clock.instant(),
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } finally {
            ThreadContext.clearMap();
            ThreadContext.putAll(previousContext);
        }
        metrics.recordExecution(source, result, failureReason, System.nanoTime() - startNanos);
        LOG.debug("Routine {} execution {} finished in {} ms: success={}",
                id, executionId, TimeUtils.elapsedMillis(startNanos), result.success());
        return result;
    }

    /**
     * Increments the execution count on a fresh read. Store failures mark the execution failed but
     * keep the action results.
     */
    private RoutineExecution recordRun(String id, String executionId, Instant start, List<ActionResult> results) {
        Instant finished = clock.instant();
        try {
            guard.withLock(id, () -> {
                Optional<MemoryRecord> fresh = store.getMemoryById(id).filter(codec::isRoutine);
                if (fresh.isEmpty()) {
                    LOG.warn("Routine {} was deleted during execution, count not updated", id);
                    return null;
                }
                Routine current = codec.fromRecord(fresh.get());
                Routine counted = new Routine(current.id(), current.name(), current.description(), current.trigger(),
                        current.conditions(), current.actions(), current.tags(), current.enabled(),
                        current.executionCount() + 1, finished, current.createdAt(), current.createdFromTask());
                write(fresh.get(), counted);
                return null;
            });
        } catch (RuntimeException e) {
            LOG.error("Failed to record execution of routine {}: {}", id, e.getMessage());
            return new RoutineExecution(id, executionId, start, clock.instant(), false,
                    "Failed to record execution: " + e.getMessage(), results);
        }
        return RoutineExecution.succeeded(id, executionId, start, finished, results);
    }

    // ---- store helpers ----

    private Optional<Routine> findRoutine(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return store.getMemoryById(id).filter(codec::isRoutine).map(codec::fromRecord);
    }

    private MemoryRecord requireRecord(String id) {
        if (id == null) {
            throw new RoutineNotFoundException(null);
        }
        return store.getMemoryById(id).filter(codec::isRoutine).orElseThrow(() -> new RoutineNotFoundException(id));
    }

    private String writeNew(Routine routine) {
        try {
            return store.addMemory(codec.toText(routine), storeProps.getSpeaker(), storeProps.getKind(),
                    storeProps.getPersona(), storeProps.getImportance(), codec.toMetadata(routine));
        } catch (RoutineStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RoutineStoreException("Failed to store routine '" + routine.name() + "'", e);
        }
    }

    private void write(MemoryRecord record, Routine routine) {
        boolean updated;
        try {
            updated = store.updateMemory(record.id(),
                    record.withContent(codec.toText(routine), codec.toMetadata(routine)));
        } catch (RoutineStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RoutineStoreException("Failed to update routine " + record.id(), e);
        }
        if (!updated) {
            throw new RoutineStoreException("Store refused to update routine " + record.id());
        }
    }

    private static Routine merge(Routine current, RoutineUpdate u) {
        return new Routine(
                current.id(),
                u.name() != null ? u.name() : current.name(),
                u.description() != null ? u.description() : current.description(),
                u.trigger() != null ? u.trigger() : current.trigger(),
                u.conditions() != null ? u.conditions() : current.conditions(),
                u.actions() != null ? u.actions() : current.actions(),
                u.tags() != null ? u.tags() : current.tags(),
                u.enabled() != null ? u.enabled() : current.enabled(),
                current.executionCount(),
                current.lastExecuted(),
                current.createdAt(),
                current.createdFromTask());
    }

    private static Routine withId(Routine r, String id) {
        return new Routine(id, r.name(), r.description(), r.trigger(), r.conditions(), r.actions(), r.tags(),
                r.enabled(), r.executionCount(), r.lastExecuted(), r.createdAt(), r.createdFromTask());
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new RoutineValidationException(field, "Routine " + field + " must not be blank");
        }
    }
}
