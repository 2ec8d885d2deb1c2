package com.phillippitts.routineengine.exception;

/**
 * Base exception for all routine-engine errors.
 * Domain exceptions extend this class so callers and the REST layer can handle them uniformly.
 */
public class RoutineEngineException extends RuntimeException {

    public RoutineEngineException(String message) {
        super(message);
    }

    public RoutineEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public RoutineEngineException(Throwable cause) {
        super(cause);
    }
}
