package com.phillippitts.routineengine.exception;

/**
 * Failure inside one poll tick of a state or vision trigger. Logged and published; the
 * mechanism keeps running and retries on the next tick.
 */
public class TriggerPollException extends RoutineEngineException {

    private final String routineId;
    private final String source;

    public TriggerPollException(String routineId, String source, String message, Throwable cause) {
        super(message + " (routine: " + routineId + ", source: " + source + ")", cause);
        this.routineId = routineId;
        this.source = source;
    }

    public String getRoutineId() {
        return routineId;
    }

    public String getSource() {
        return source;
    }
}
