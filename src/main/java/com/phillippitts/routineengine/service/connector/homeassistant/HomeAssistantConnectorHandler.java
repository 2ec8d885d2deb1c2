package com.phillippitts.routineengine.service.connector.homeassistant;

import com.phillippitts.routineengine.service.connector.ConnectorHandler;
import com.phillippitts.routineengine.service.connector.ConnectorResult;
import com.phillippitts.routineengine.service.state.EntityState;
import com.phillippitts.routineengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Connector for the {@code homeassistant} service.
 *
 * <p>Methods:
 * <ul>
 *   <li>{@code get_state{entityId}}</li>
 *   <li>{@code call_service{domain, service, data}}</li>
 *   <li>{@code set_state{entityId, service | state, domain?, data?}}: {@code call_service} with
 *       {@code entity_id} added to the payload; the domain defaults to the entity prefix and
 *       {@code state=on|off} maps to {@code turn_on|turn_off}</li>
 * </ul>
 */
public class HomeAssistantConnectorHandler implements ConnectorHandler {

    private static final Logger LOG = LogManager.getLogger(HomeAssistantConnectorHandler.class);

    static final String SETUP_INSTRUCTIONS =
            "Create a long-lived access token in Home Assistant and set connectors.homeassistant.token";

    private final HomeAssistantClient client;

    public HomeAssistantConnectorHandler(HomeAssistantClient client) {
        this.client = client;
    }

    @Override
    public String serviceId() {
        return HomeAssistantClient.SERVICE_ID;
    }

    @Override
    public ConnectorResult handle(String method, Map<String, Object> parameters) {
        Map<String, Object> params = parameters == null ? Map.of() : parameters;
        if (!client.hasToken()) {
            return ConnectorResult.setupRequired("Home Assistant token is not configured", SETUP_INSTRUCTIONS);
        }
        LOG.debug("Home Assistant {} with parameters {}", method, LogSanitizer.keysOnly(params));
        String m = method == null ? "" : method.toLowerCase(Locale.ROOT);
        return switch (m) {
            case "get_state" -> getState(params);
            case "call_service" -> callService(params);
            case "set_state" -> setState(params);
            default -> ConnectorResult.failure("Unsupported homeassistant method: " + method);
        };
    }

    private ConnectorResult getState(Map<String, Object> params) {
        String entityId = text(params.get("entityId"));
        if (entityId == null) {
            return ConnectorResult.failure("get_state requires entityId");
        }
        EntityState state = client.getState(entityId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entityId", state.entityId());
        data.put("state", state.state());
        data.put("attributes", state.attributes());
        return ConnectorResult.ok(data);
    }

    private ConnectorResult callService(Map<String, Object> params) {
        String domain = text(params.get("domain"));
        String service = text(params.get("service"));
        if (domain == null || service == null) {
            return ConnectorResult.failure("call_service requires domain and service");
        }
        return ConnectorResult.ok(client.callService(domain, service, payload(params.get("data"))));
    }

    private ConnectorResult setState(Map<String, Object> params) {
        String entityId = text(params.get("entityId"));
        if (entityId == null) {
            return ConnectorResult.failure("set_state requires entityId");
        }
        String domain = text(params.get("domain"));
        if (domain == null) {
            int dot = entityId.indexOf('.');
            domain = dot > 0 ? entityId.substring(0, dot) : null;
        }
        String service = text(params.get("service"));
        if (service == null) {
            service = serviceForState(text(params.get("state")));
        }
        if (domain == null || service == null) {
            return ConnectorResult.failure("set_state requires a domain and a service or state");
        }
        Map<String, Object> payload = payload(params.get("data"));
        payload.put("entity_id", entityId);
        return ConnectorResult.ok(client.callService(domain, service, payload));
    }

    private static String serviceForState(String state) {
        if (state == null) {
            return null;
        }
        return switch (state.toLowerCase(Locale.ROOT)) {
            case "on" -> "turn_on";
            case "off" -> "turn_off";
            default -> null;
        };
    }

    private static Map<String, Object> payload(Object raw) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> payload.put(String.valueOf(k), v));
        }
        return payload;
    }

    private static String text(Object raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.toString();
        return s.isBlank() ? null : s;
    }
}
