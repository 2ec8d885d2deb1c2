package com.phillippitts.routineengine.service.connector;

import java.util.Map;

/**
 * Backend for {@code connector_call} and {@code state_change} actions. One handler per service id.
 */
public interface ConnectorHandler {

    /**
     * Service id actions refer to, e.g. {@code homeassistant}. Must be unique across handlers.
     */
    String serviceId();

    /**
     * Invokes {@code method} with the action parameters. May throw; the dispatcher converts
     * exceptions into failed action results.
     */
    ConnectorResult handle(String method, Map<String, Object> parameters);
}
