package com.phillippitts.routineengine.service.connector;

/**
 * Uniform outcome returned by every connector handler.
 *
 * @param success           whether the call succeeded
 * @param data              response payload, may be null
 * @param error             failure reason when unsuccessful
 * @param requiresSetup     true when the connector is not configured yet
 * @param setupInstructions guidance for the user when setup is required
 */
public record ConnectorResult(
        boolean success,
        Object data,
        String error,
        boolean requiresSetup,
        String setupInstructions
) {

    public static ConnectorResult ok(Object data) {
        return new ConnectorResult(true, data, null, false, null);
    }

    public static ConnectorResult failure(String error) {
        return new ConnectorResult(false, null, error, false, null);
    }

    public static ConnectorResult setupRequired(String error, String instructions) {
        return new ConnectorResult(false, null, error, true, instructions);
    }
}
