package com.phillippitts.routineengine.service.pattern;

import com.phillippitts.routineengine.domain.RoutinePattern;

import java.time.Instant;

/**
 * Published for each detected pattern whose confidence reaches the configured threshold.
 */
public record RoutinePatternDetectedEvent(RoutinePattern pattern, Instant at) {
    public RoutinePatternDetectedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
