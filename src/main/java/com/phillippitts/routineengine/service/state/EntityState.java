package com.phillippitts.routineengine.service.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of an external entity: top-level state plus attribute bag.
 *
 * @param entityId   entity identifier, e.g. {@code light.kitchen}
 * @param state      top-level state value, may be null
 * @param attributes attribute values, never null
 */
public record EntityState(String entityId, Object state, Map<String, Object> attributes) {

    public EntityState {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * The attribute named {@code property}, or the top-level state when {@code property} is null or blank.
     */
    public Object valueOf(String property) {
        if (property == null || property.isBlank()) {
            return state;
        }
        return attributes.get(property);
    }
}
