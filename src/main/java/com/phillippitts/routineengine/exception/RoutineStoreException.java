package com.phillippitts.routineengine.exception;

/**
 * Thrown when the record store fails or refuses a write.
 */
public class RoutineStoreException extends RoutineEngineException {

    public RoutineStoreException(String message) {
        super(message);
    }

    public RoutineStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
