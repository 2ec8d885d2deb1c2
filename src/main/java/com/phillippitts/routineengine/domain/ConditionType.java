package com.phillippitts.routineengine.domain;

import java.util.Locale;

/** Condition kinds, keyed by stored wire name. Unrecognised names map to {@link #UNKNOWN}. */
public enum ConditionType {
    TIME_RANGE("time_range"),
    STATE_CHECK("state_check"),
    COMPARISON("comparison"),
    CUSTOM("custom"),
    UNKNOWN("unknown");

    private final String wireName;

    ConditionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ConditionType fromWire(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ConditionType t : values()) {
            if (t != UNKNOWN && t.wireName.equals(normalized)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
