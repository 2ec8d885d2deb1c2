package com.phillippitts.routineengine.domain;

/**
 * External entity watched by a state-change trigger.
 *
 * @param service  state provider id; only {@code "homeassistant"} is supported
 * @param entity   entity id at the provider (e.g. {@code light.kitchen})
 * @param property optional attribute name; when null the top-level state value is compared
 */
public record Monitor(String service, String entity, String property) {
}
