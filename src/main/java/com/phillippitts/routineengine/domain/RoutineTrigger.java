package com.phillippitts.routineengine.domain;

import java.util.List;

/**
 * When a routine fires: a trigger type name plus its type-specific configuration.
 *
 * <p>The raw {@code type} text is kept as stored so unrecognised trigger kinds round-trip
 * untouched; {@link #kind()} resolves it to a {@link TriggerType}.
 *
 * @param type   wire name of the trigger type (e.g. {@code "time"}), may be null for malformed records
 * @param config type-specific configuration, never null
 */
public record RoutineTrigger(String type, TriggerConfig config) {

    public RoutineTrigger {
        if (config == null) {
            config = TriggerConfig.EMPTY;
        }
    }

    public TriggerType kind() {
        return TriggerType.fromWire(type);
    }

    public static RoutineTrigger time(String schedule) {
        return new RoutineTrigger(TriggerType.TIME.wireName(), TriggerConfig.builder().schedule(schedule).build());
    }

    public static RoutineTrigger stateChange(String service, String entity, String property) {
        return new RoutineTrigger(TriggerType.STATE_CHANGE.wireName(),
                TriggerConfig.builder().monitor(new Monitor(service, entity, property)).build());
    }

    public static RoutineTrigger visionDetection(String service, List<String> objectTypes) {
        return visionDetection(new VisionDetectionConfig(service, null, objectTypes, null, null, null, null));
    }

    public static RoutineTrigger visionDetection(VisionDetectionConfig vision) {
        return new RoutineTrigger(TriggerType.VISION_DETECTION.wireName(),
                TriggerConfig.builder().visionDetection(vision).build());
    }

    public static RoutineTrigger event(String eventName) {
        return new RoutineTrigger(TriggerType.EVENT.wireName(), TriggerConfig.builder().eventName(eventName).build());
    }

    public static RoutineTrigger completion(String taskPattern) {
        return new RoutineTrigger(TriggerType.COMPLETION.wireName(),
                TriggerConfig.builder().taskPattern(taskPattern).build());
    }

    /**
     * Short human-readable description, used in the stored record text and in logs.
     */
    public String describe() {
        return switch (kind()) {
            case TIME -> "Time-based: " + orDefault(config.schedule(), "No schedule");
            case EVENT -> "Event: " + orDefault(config.eventName(), "Unknown event");
            case STATE_CHANGE -> "State change: "
                    + orDefault(config.monitor() == null ? null : config.monitor().service(), "Unknown service");
            case USER_ACTION -> "User action: " + orDefault(config.actionType(), "Unknown action");
            case COMPLETION -> "Task completion: " + orDefault(config.taskPattern(), "Any task");
            case VISION_DETECTION -> describeVision(config.visionDetection());
            case UNKNOWN -> "Unknown trigger";
        };
    }

    private static String describeVision(VisionDetectionConfig vision) {
        String service = vision == null ? null : vision.service();
        List<String> objects = vision == null ? List.of() : vision.objectTypes();
        return "Vision detection: " + orDefault(service, "Unknown service") + " detecting "
                + (objects.isEmpty() ? "objects" : String.join(", ", objects));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
