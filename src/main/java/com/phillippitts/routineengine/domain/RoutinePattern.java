package com.phillippitts.routineengine.domain;

/**
 * A recurring behaviour found in completed-task history, with a routine that would automate it.
 *
 * @param type             pattern family
 * @param description      user-facing suggestion text
 * @param occurrences      how often the pattern was observed
 * @param confidence       share of the relevant history the pattern explains, 0.0 to 1.0
 * @param suggestedRoutine routine definition ready to be passed to {@code createRoutine}
 */
public record RoutinePattern(
        Type type,
        String description,
        int occurrences,
        double confidence,
        RoutineDefinition suggestedRoutine
) {

    public enum Type { TEMPORAL, SEQUENTIAL }

    public RoutinePattern {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
