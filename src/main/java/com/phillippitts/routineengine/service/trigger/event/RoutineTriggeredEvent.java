package com.phillippitts.routineengine.service.trigger.event;

import java.time.Instant;

/**
 * Published when a trigger mechanism fires for a routine.
 *
 * @param routineId routine to execute
 * @param source    trigger kind that fired ({@code time}, {@code state_change}, {@code vision_detection})
 * @param at        fire time
 * @param detail    short description of what fired, e.g. the observed state change
 */
public record RoutineTriggeredEvent(String routineId, String source, Instant at, String detail) {
    public RoutineTriggeredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
