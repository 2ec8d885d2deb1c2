package com.phillippitts.routineengine.service.trigger.event;

import java.time.Instant;

/**
 * Published when one poll tick of a state or vision trigger fails. The mechanism stays registered.
 */
public record TriggerPollFailedEvent(
        String routineId,
        String source,
        Instant at,
        String message,
        Throwable cause
) {
    public TriggerPollFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
