package com.phillippitts.routineengine.service.state;

/**
 * Reads current entity state from an external system. Used by state-change triggers and by
 * {@code state_check}/{@code comparison} conditions.
 *
 * <p>Implementations throw a runtime exception when the lookup fails; callers wrap it.
 */
public interface StateQuerySource {

    /**
     * Service id this source answers for, e.g. {@code homeassistant}.
     */
    String service();

    EntityState getState(String entityId);
}
