package com.phillippitts.routineengine.domain;

import java.util.Locale;

/**
 * Trigger kinds understood by the engine, keyed by their stored wire name.
 *
 * <p>Names that are not recognised map to {@link #UNKNOWN}; the original text is kept on the
 * {@link RoutineTrigger} so it survives a store round trip.
 */
public enum TriggerType {
    TIME("time"),
    EVENT("event"),
    STATE_CHANGE("state_change"),
    USER_ACTION("user_action"),
    COMPLETION("completion"),
    VISION_DETECTION("vision_detection"),
    UNKNOWN("unknown");

    private final String wireName;

    TriggerType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static TriggerType fromWire(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (TriggerType t : values()) {
            if (t != UNKNOWN && t.wireName.equals(normalized)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
