package com.phillippitts.routineengine.domain;

import java.util.Locale;

/** Action kinds, keyed by stored wire name. Unrecognised names map to {@link #UNKNOWN}. */
public enum ActionType {
    CONNECTOR_CALL("connector_call"),
    NOTIFICATION("notification"),
    STATE_CHANGE("state_change"),
    CUSTOM("custom"),
    UNKNOWN("unknown");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ActionType fromWire(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ActionType t : values()) {
            if (t != UNKNOWN && t.wireName.equals(normalized)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
