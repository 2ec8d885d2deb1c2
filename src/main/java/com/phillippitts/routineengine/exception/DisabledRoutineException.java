package com.phillippitts.routineengine.exception;

/**
 * Raised when an automatic execution reaches a routine that has been disabled in the meantime.
 * Captured into the execution result; never propagated out of {@code executeRoutine}.
 */
public class DisabledRoutineException extends RoutineEngineException {

    private final String routineId;

    public DisabledRoutineException(String routineId) {
        super("Routine " + routineId + " is disabled");
        this.routineId = routineId;
    }

    public String getRoutineId() {
        return routineId;
    }
}
