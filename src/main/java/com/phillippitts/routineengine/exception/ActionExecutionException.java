package com.phillippitts.routineengine.exception;

/**
 * Failure of a single action. Converted into a failed action result by the dispatcher.
 */
public class ActionExecutionException extends RoutineEngineException {

    private final String actionType;

    public ActionExecutionException(String actionType, String message, Throwable cause) {
        super(message, cause);
        this.actionType = actionType;
    }

    public String getActionType() {
        return actionType;
    }
}
