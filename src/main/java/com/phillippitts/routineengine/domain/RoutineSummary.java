package com.phillippitts.routineengine.domain;

import java.time.Instant;
import java.util.List;

/**
 * List view of a routine.
 */
public record RoutineSummary(
        String id,
        String name,
        String description,
        boolean enabled,
        Instant lastExecuted,
        long executionCount,
        List<String> tags
) {
}
