package com.phillippitts.routineengine.domain;

import java.time.Instant;
import java.util.List;

/**
 * Record of one run of a routine. Not persisted; returned to manual callers and logged for
 * automatic runs.
 *
 * @param routineId   routine that ran
 * @param executionId unique id of this run
 * @param startTime   when the run started
 * @param endTime     when the run finished
 * @param success     true when the action pipeline ran
 * @param error       failure reason, null on success
 * @param results     one result per action, null when actions did not run
 */
public record RoutineExecution(
        String routineId,
        String executionId,
        Instant startTime,
        Instant endTime,
        boolean success,
        String error,
        List<ActionResult> results
) {

    public static final String CONDITIONS_NOT_MET = "Conditions not met";

    public RoutineExecution {
        results = results == null ? null : List.copyOf(results);
    }

    public static RoutineExecution succeeded(String routineId, String executionId, Instant start, Instant end,
                                             List<ActionResult> results) {
        return new RoutineExecution(routineId, executionId, start, end, true, null, results);
    }

    public static RoutineExecution failed(String routineId, String executionId, Instant start, Instant end,
                                          String error) {
        return new RoutineExecution(routineId, executionId, start, end, false, error, null);
    }

    public boolean skippedByConditions() {
        return !success && CONDITIONS_NOT_MET.equals(error);
    }
}
