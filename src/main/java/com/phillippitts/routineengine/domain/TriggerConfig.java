package com.phillippitts.routineengine.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Type-specific trigger settings. Only the field matching the trigger type is meaningful.
 *
 * <p>{@code extra} holds any configuration keys this version does not model (for example
 * settings of trigger kinds added by newer clients) so they are written back unchanged.
 */
public record TriggerConfig(
        String schedule,
        String eventName,
        Monitor monitor,
        String actionType,
        String taskPattern,
        VisionDetectionConfig visionDetection,
        Map<String, Object> extra
) {
    public static final TriggerConfig EMPTY = new TriggerConfig(null, null, null, null, null, null, Map.of());

    public TriggerConfig {
        extra = PayloadValues.normalize(extra);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder; unset fields stay null. */
    public static final class Builder {
        private String schedule;
        private String eventName;
        private Monitor monitor;
        private String actionType;
        private String taskPattern;
        private VisionDetectionConfig visionDetection;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder monitor(Monitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder actionType(String actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder taskPattern(String taskPattern) {
            this.taskPattern = taskPattern;
            return this;
        }

        public Builder visionDetection(VisionDetectionConfig visionDetection) {
            this.visionDetection = visionDetection;
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public TriggerConfig build() {
            return new TriggerConfig(schedule, eventName, monitor, actionType, taskPattern, visionDetection, extra);
        }
    }
}
