package com.phillippitts.routineengine.exception;

/**
 * Thrown when an operation names a routine id the store does not hold.
 */
public class RoutineNotFoundException extends RoutineEngineException {

    private final String routineId;

    public RoutineNotFoundException(String routineId) {
        super("Routine with ID " + routineId + " not found");
        this.routineId = routineId;
    }

    public String getRoutineId() {
        return routineId;
    }
}
