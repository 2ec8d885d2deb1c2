package com.phillippitts.routineengine.domain;

import java.util.List;

/**
 * Partial update of a routine. Null fields keep the stored value.
 */
public record RoutineUpdate(
        String name,
        String description,
        Boolean enabled,
        RoutineTrigger trigger,
        List<RoutineCondition> conditions,
        List<RoutineAction> actions,
        List<String> tags
) {

    public static RoutineUpdate enabled(boolean enabled) {
        return builder().enabled(enabled).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return name == null && description == null && enabled == null && trigger == null
                && conditions == null && actions == null && tags == null;
    }

    /** Fluent builder for partial updates. */
    public static final class Builder {
        private String name;
        private String description;
        private Boolean enabled;
        private RoutineTrigger trigger;
        private List<RoutineCondition> conditions;
        private List<RoutineAction> actions;
        private List<String> tags;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder trigger(RoutineTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder conditions(List<RoutineCondition> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder actions(List<RoutineAction> actions) {
            this.actions = actions;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public RoutineUpdate build() {
            return new RoutineUpdate(name, description, enabled, trigger, conditions, actions, tags);
        }
    }
}
