package com.phillippitts.routineengine.service.trigger;

import com.phillippitts.routineengine.service.state.EntityState;
import com.phillippitts.routineengine.service.state.StateQuerySource;

import java.util.Objects;
import java.util.Optional;

/**
 * Detects changes of one entity value between polls.
 *
 * <p>The first successful poll only records the baseline. Each later poll compares the observed
 * value with {@link Objects#equals}; a difference is reported once and becomes the new baseline.
 * A failed lookup leaves the baseline untouched.
 */
final class StateChangePoller {

    private final StateQuerySource source;
    private final String entity;
    private final String property;

    private boolean baselineSet;
    private Object lastValue;

    StateChangePoller(StateQuerySource source, String entity, String property) {
        this.source = source;
        this.entity = entity;
        this.property = property;
    }

    /**
     * @return a description of the change when the value changed since the previous poll
     */
    synchronized Optional<String> poll() {
        EntityState state = source.getState(entity);
        Object value = state == null ? null : state.valueOf(property);
        if (!baselineSet) {
            baselineSet = true;
            lastValue = value;
            return Optional.empty();
        }
        if (Objects.equals(lastValue, value)) {
            return Optional.empty();
        }
        String detail = describe() + ": " + lastValue + " -> " + value;
        lastValue = value;
        return Optional.of(detail);
    }

    private String describe() {
        return property == null || property.isBlank() ? entity : entity + "." + property;
    }

    synchronized Object lastValue() {
        return lastValue;
    }
}
