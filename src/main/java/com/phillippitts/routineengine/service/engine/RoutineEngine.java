package com.phillippitts.routineengine.service.engine;

import com.phillippitts.routineengine.domain.RoutineDefinition;
import com.phillippitts.routineengine.domain.RoutineDetail;
import com.phillippitts.routineengine.domain.RoutineExecution;
import com.phillippitts.routineengine.domain.RoutineSummary;
import com.phillippitts.routineengine.domain.RoutineUpdate;
import com.phillippitts.routineengine.service.trigger.event.RoutineTriggeredEvent;

import java.util.List;
import java.util.Optional;

/**
 * Creates, edits and runs routines.
 *
 * <p>Mutations fail fast with {@link com.phillippitts.routineengine.exception.RoutineValidationException},
 * {@link com.phillippitts.routineengine.exception.RoutineNotFoundException} or
 * {@link com.phillippitts.routineengine.exception.RoutineStoreException}. Execution never throws; failures
 * are reported in the returned {@link RoutineExecution}.
 */
public interface RoutineEngine {

    /**
     * Persists a new, enabled routine and registers its trigger.
     *
     * @return the store-assigned id
     */
    String createRoutine(RoutineDefinition definition);

    List<RoutineSummary> getRoutines(boolean enabledOnly);

    Optional<RoutineDetail> getRoutineById(String id);

    /**
     * Like {@link #getRoutineById(String)} but throws when the routine does not exist.
     */
    RoutineDetail requireRoutine(String id);

    /**
     * Merges the non-null fields of {@code update} into the stored routine and re-registers its trigger
     * according to the resulting enabled state.
     */
    void updateRoutine(String id, RoutineUpdate update);

    void deleteRoutine(String id);

    /**
     * Flips the enabled flag.
     *
     * @return the new enabled state
     */
    boolean toggleRoutine(String id);

    /**
     * Runs a routine once.
     *
     * @param manualTrigger true for explicit user requests: failed conditions are bypassed and a
     *                      disabled routine still runs
     */
    RoutineExecution executeRoutine(String id, boolean manualTrigger);

    /**
     * Entry point for trigger fires. Drops the tick when an execution of the same routine is in flight.
     */
    void onRoutineTriggered(RoutineTriggeredEvent event);
}
