package com.phillippitts.routineengine.service.store;

/**
 * Keys of the metadata bag of a routine record.
 */
public final class RoutineMetadataKeys {

    public static final String TYPE = "type";
    public static final String ROUTINE_TYPE = "routine";
    public static final String NAME = "routineName";
    public static final String DESCRIPTION = "routineDescription";
    public static final String ENABLED = "routineEnabled";
    public static final String EXECUTION_COUNT = "routineExecutionCount";
    public static final String TRIGGER = "routineTrigger";
    public static final String CONDITIONS = "routineConditions";
    public static final String ACTIONS = "routineActions";
    public static final String TAGS = "routineTags";
    public static final String CREATED_FROM_TASK = "routineCreatedFromTask";
    public static final String CREATED_AT = "createdAt";
    public static final String LAST_EXECUTED = "lastExecuted";

    private RoutineMetadataKeys() {
    }
}
