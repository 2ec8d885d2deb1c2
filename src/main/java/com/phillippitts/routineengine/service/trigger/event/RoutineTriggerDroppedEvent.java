package com.phillippitts.routineengine.service.trigger.event;

import java.time.Instant;

/**
 * Published when a trigger tick is discarded without running the routine, e.g. because an
 * execution of the same routine is still in flight or the routine no longer exists.
 */
public record RoutineTriggerDroppedEvent(String routineId, String source, Instant at, String reason) {
    public RoutineTriggerDroppedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
