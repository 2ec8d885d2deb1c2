package com.phillippitts.routineengine.domain;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Persisted automation rule: trigger, gating conditions and an ordered action pipeline.
 *
 * <p>Instances are immutable snapshots of the stored record. Mutation goes through the engine,
 * which writes a new record and re-reads it.
 *
 * @param id              store-assigned identifier
 * @param name            display name
 * @param description     free-text description
 * @param trigger         when the routine fires
 * @param conditions      gates, all of which must pass for automatic runs
 * @param actions         ordered actions
 * @param tags            labels, duplicates removed in first-seen order
 * @param enabled         whether a trigger mechanism should be live
 * @param executionCount  number of successful executions
 * @param lastExecuted    time of the last successful execution, null if never run
 * @param createdAt       creation time
 * @param createdFromTask optional id of the task this routine was derived from
 */
public record Routine(
        String id,
        String name,
        String description,
        RoutineTrigger trigger,
        List<RoutineCondition> conditions,
        List<RoutineAction> actions,
        List<String> tags,
        boolean enabled,
        long executionCount,
        Instant lastExecuted,
        Instant createdAt,
        String createdFromTask
) {

    public Routine {
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        trigger = trigger == null ? new RoutineTrigger(null, null) : trigger;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        actions = actions == null ? List.of() : List.copyOf(actions);
        tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
        if (executionCount < 0) {
            throw new IllegalArgumentException("executionCount must not be negative, got: " + executionCount);
        }
    }

    public RoutineSummary toSummary() {
        return new RoutineSummary(id, name, description, enabled, lastExecuted, executionCount, tags);
    }

    public RoutineDetail toDetail() {
        return new RoutineDetail(id, name, description, enabled, lastExecuted, executionCount, tags,
                createdAt, trigger, conditions, actions, createdFromTask);
    }
}
