package com.phillippitts.routineengine.domain;

import java.util.List;

/**
 * Input for creating a routine. Validation happens in the engine so that callers get a
 * {@link com.phillippitts.routineengine.exception.RoutineValidationException} naming the bad field.
 *
 * @param name            non-blank display name
 * @param description     non-blank description
 * @param trigger         trigger definition
 * @param conditions      optional gates (null means none)
 * @param actions         at least one action
 * @param tags            optional labels
 * @param createdFromTask optional back-reference to a task id
 */
public record RoutineDefinition(
        String name,
        String description,
        RoutineTrigger trigger,
        List<RoutineCondition> conditions,
        List<RoutineAction> actions,
        List<String> tags,
        String createdFromTask
) {
    public RoutineDefinition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        actions = actions == null ? List.of() : List.copyOf(actions);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static RoutineDefinition of(String name, String description, RoutineTrigger trigger,
                                       List<RoutineAction> actions) {
        return new RoutineDefinition(name, description, trigger, List.of(), actions, List.of(), null);
    }
}
