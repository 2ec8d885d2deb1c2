package com.phillippitts.routineengine.domain;

import java.time.Instant;
import java.util.List;

/**
 * Full view of a routine, as returned by a lookup by id.
 */
public record RoutineDetail(
        String id,
        String name,
        String description,
        boolean enabled,
        Instant lastExecuted,
        long executionCount,
        List<String> tags,
        Instant createdAt,
        RoutineTrigger trigger,
        List<RoutineCondition> conditions,
        List<RoutineAction> actions,
        String createdFromTask
) {

    public RoutineSummary summary() {
        return new RoutineSummary(id, name, description, enabled, lastExecuted, executionCount, tags);
    }
}
