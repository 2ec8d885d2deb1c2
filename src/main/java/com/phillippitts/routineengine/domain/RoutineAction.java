package com.phillippitts.routineengine.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of externally visible effect performed when a routine runs.
 *
 * @param type       wire name of the action type (e.g. {@code "connector_call"})
 * @param service    connector service id for connector-backed actions
 * @param method     connector method for {@code connector_call}
 * @param parameters action parameters, never null; numbers normalised by {@link PayloadValues}
 */
public record RoutineAction(String type, String service, String method, Map<String, Object> parameters) {

    public RoutineAction {
        parameters = PayloadValues.normalize(parameters);
    }

    public ActionType kind() {
        return ActionType.fromWire(type);
    }

    public static RoutineAction notification(String message) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (message != null) {
            params.put("message", message);
        }
        return new RoutineAction(ActionType.NOTIFICATION.wireName(), null, null, params);
    }

    public static RoutineAction connectorCall(String service, String method, Map<String, Object> parameters) {
        return new RoutineAction(ActionType.CONNECTOR_CALL.wireName(), service, method, parameters);
    }

    public static RoutineAction of(ActionType type, String service, Map<String, Object> parameters) {
        return new RoutineAction(type.wireName(), service, null, parameters);
    }
}
