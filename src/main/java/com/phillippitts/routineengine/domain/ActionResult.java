package com.phillippitts.routineengine.domain;

/**
 * Outcome of one action within an execution.
 *
 * @param success            whether the action achieved its effect
 * @param message            human-readable outcome (e.g. the notification text)
 * @param error              failure reason, null on success
 * @param data               payload returned by a connector, may be null
 * @param requiresSetup      true when the connector reported missing configuration
 * @param setupInstructions  connector guidance for the user when setup is required
 */
public record ActionResult(
        boolean success,
        String message,
        String error,
        Object data,
        boolean requiresSetup,
        String setupInstructions
) {

    public static ActionResult ok(String message) {
        return new ActionResult(true, message, null, null, false, null);
    }

    public static ActionResult ok(String message, Object data) {
        return new ActionResult(true, message, null, data, false, null);
    }

    public static ActionResult failed(String error) {
        return new ActionResult(false, null, error, null, false, null);
    }
}
