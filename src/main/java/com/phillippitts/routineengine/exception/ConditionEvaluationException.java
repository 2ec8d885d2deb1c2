package com.phillippitts.routineengine.exception;

/**
 * Thrown when a condition cannot be evaluated: unsupported kind, missing state source, or a
 * failed state lookup.
 */
public class ConditionEvaluationException extends RoutineEngineException {

    private final String conditionType;

    public ConditionEvaluationException(String conditionType, String message) {
        super(message);
        this.conditionType = conditionType;
    }

    public ConditionEvaluationException(String conditionType, String message, Throwable cause) {
        super(message, cause);
        this.conditionType = conditionType;
    }

    public String getConditionType() {
        return conditionType;
    }
}
