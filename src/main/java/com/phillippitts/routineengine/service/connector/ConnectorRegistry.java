package com.phillippitts.routineengine.service.connector;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit service-id to handler map, built once at startup.
 *
 * <p>Duplicate service ids fail construction with {@link IllegalStateException}. A lookup for an
 * unknown id returns empty; routines may outlive the handler they reference.
 */
public final class ConnectorRegistry {

    private static final Logger LOG = LogManager.getLogger(ConnectorRegistry.class);

    private final Map<String, ConnectorHandler> handlers;

    public ConnectorRegistry(List<ConnectorHandler> handlers) {
        Map<String, ConnectorHandler> map = new LinkedHashMap<>();
        for (ConnectorHandler h : handlers == null ? List.<ConnectorHandler>of() : handlers) {
            String id = h.serviceId();
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Connector handler " + h.getClass().getName()
                        + " has no service id");
            }
            ConnectorHandler previous = map.putIfAbsent(id, h);
            if (previous != null) {
                throw new IllegalStateException("Duplicate connector handler for service '" + id + "': "
                        + previous.getClass().getName() + " and " + h.getClass().getName());
            }
        }
        this.handlers = Collections.unmodifiableMap(map);
        LOG.info("Connector registry initialised with services {}", this.handlers.keySet());
    }

    public static ConnectorRegistry empty() {
        return new ConnectorRegistry(List.of());
    }

    public Optional<ConnectorHandler> find(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(serviceId));
    }

    public Set<String> serviceIds() {
        return handlers.keySet();
    }
}
