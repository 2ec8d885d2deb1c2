package com.phillippitts.routineengine.exception;

/**
 * Thrown when a routine definition or update is rejected (blank name or description,
 * missing trigger, empty action list). User-correctable.
 */
public class RoutineValidationException extends RoutineEngineException {

    private final String field;

    public RoutineValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
