package com.phillippitts.routineengine.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A gate evaluated before a routine's actions run.
 *
 * @param type   wire name of the condition type (e.g. {@code "time_range"})
 * @param config type-specific settings, never null
 */
public record RoutineCondition(String type, Map<String, Object> config) {

    public RoutineCondition {
        config = PayloadValues.normalize(config);
    }

    public ConditionType kind() {
        return ConditionType.fromWire(type);
    }

    public static RoutineCondition timeRange(int startHour, int endHour) {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("startHour", startHour);
        cfg.put("endHour", endHour);
        return new RoutineCondition(ConditionType.TIME_RANGE.wireName(), cfg);
    }

    public static RoutineCondition of(ConditionType type, Map<String, Object> config) {
        return new RoutineCondition(type.wireName(), config);
    }
}
