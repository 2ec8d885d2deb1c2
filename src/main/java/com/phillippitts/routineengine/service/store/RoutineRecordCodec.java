package com.phillippitts.routineengine.service.store;

import com.phillippitts.routineengine.domain.Monitor;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.RoutineAction;
import com.phillippitts.routineengine.domain.RoutineCondition;
import com.phillippitts.routineengine.domain.RoutineTrigger;
import com.phillippitts.routineengine.domain.TriggerConfig;
import com.phillippitts.routineengine.domain.VisionDetectionConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.ACTIONS;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.CONDITIONS;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.CREATED_AT;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.CREATED_FROM_TASK;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.DESCRIPTION;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.ENABLED;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.EXECUTION_COUNT;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.LAST_EXECUTED;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.NAME;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.ROUTINE_TYPE;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.TAGS;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.TRIGGER;
import static com.phillippitts.routineengine.service.store.RoutineMetadataKeys.TYPE;

/**
 * Maps routines to and from the metadata bag of a memory record.
 *
 * <p>Trigger, conditions and actions are stored as JSON text so that unknown kinds and extra
 * configuration keys round-trip unchanged. Decoding tolerates records written by older versions:
 * missing fields fall back to defaults instead of failing, and a payload that is not valid JSON
 * decodes as empty (logged at WARN).
 */
public final class RoutineRecordCodec {

    private static final Logger LOG = LogManager.getLogger(RoutineRecordCodec.class);

    static final String UNTITLED = "Untitled Routine";

    private static final Set<String> KNOWN_TRIGGER_KEYS = Set.of(
            "schedule", "eventName", "monitor", "actionType", "taskPattern", "visionDetection");

    /**
     * True when the record's metadata marks it as a routine.
     */
    public boolean isRoutine(MemoryRecord record) {
        return record != null && ROUTINE_TYPE.equals(record.metadataValue(TYPE));
    }

    /**
     * Searchable record text: name, description, trigger description and action count.
     */
    public String toText(Routine routine) {
        int n = routine.actions().size();
        return routine.name() + "\n\n" + routine.description() + "\n\n"
                + "Trigger: " + routine.trigger().describe() + "\n"
                + "Actions: " + n + " action(s)";
    }

    public Map<String, Object> toMetadata(Routine routine) {
        Map<String, Object> md = new LinkedHashMap<>();
        md.put(TYPE, ROUTINE_TYPE);
        md.put(NAME, routine.name());
        md.put(DESCRIPTION, routine.description());
        md.put(ENABLED, routine.enabled());
        md.put(EXECUTION_COUNT, routine.executionCount());
        md.put(TRIGGER, encodeTrigger(routine.trigger()).toString());
        md.put(CONDITIONS, encodeConditions(routine.conditions()).toString());
        md.put(ACTIONS, encodeActions(routine.actions()).toString());
        md.put(TAGS, List.copyOf(routine.tags()));
        if (routine.createdFromTask() != null) {
            md.put(CREATED_FROM_TASK, routine.createdFromTask());
        }
        md.put(CREATED_AT, routine.createdAt().toString());
        if (routine.lastExecuted() != null) {
            md.put(LAST_EXECUTED, routine.lastExecuted().toString());
        }
        return md;
    }

    /**
     * Decodes a routine record. Callers check {@link #isRoutine(MemoryRecord)} first.
     */
    public Routine fromRecord(MemoryRecord record) {
        Map<String, Object> md = record.metadata();
        String name = textOr(md.get(NAME), UNTITLED);
        String description = textOr(md.get(DESCRIPTION), "");
        boolean enabled = booleanOr(md.get(ENABLED), true);
        long count = longOr(md.get(EXECUTION_COUNT), 0L);
        RoutineTrigger trigger = decodeTrigger(md.get(TRIGGER), record.id());
        List<RoutineCondition> conditions = decodeConditions(md.get(CONDITIONS), record.id());
        List<RoutineAction> actions = decodeActions(md.get(ACTIONS), record.id());
        List<String> tags = decodeTags(md.get(TAGS));
        Instant createdAt = instantOr(md.get(CREATED_AT), record.timestamp());
        Instant lastExecuted = instantOr(md.get(LAST_EXECUTED), null);
        String fromTask = textOr(md.get(CREATED_FROM_TASK), null);
        return new Routine(record.id(), name, description, trigger, conditions, actions, tags,
                enabled, Math.max(0L, count), lastExecuted, createdAt, fromTask);
    }

    // ---- encoding ----

    JSONObject encodeTrigger(RoutineTrigger trigger) {
        TriggerConfig cfg = trigger.config();
        JSONObject config = new JSONObject();
        for (Map.Entry<String, Object> e : cfg.extra().entrySet()) {
            config.put(e.getKey(), JsonValues.toJson(e.getValue()));
        }
        putIfPresent(config, "schedule", cfg.schedule());
        putIfPresent(config, "eventName", cfg.eventName());
        putIfPresent(config, "actionType", cfg.actionType());
        putIfPresent(config, "taskPattern", cfg.taskPattern());
        if (cfg.monitor() != null) {
            JSONObject monitor = new JSONObject();
            putIfPresent(monitor, "service", cfg.monitor().service());
            putIfPresent(monitor, "entity", cfg.monitor().entity());
            putIfPresent(monitor, "property", cfg.monitor().property());
            config.put("monitor", monitor);
        }
        if (cfg.visionDetection() != null) {
            config.put("visionDetection", encodeVision(cfg.visionDetection()));
        }
        JSONObject obj = new JSONObject();
        putIfPresent(obj, "type", trigger.type());
        obj.put("config", config);
        return obj;
    }

    private static JSONObject encodeVision(VisionDetectionConfig v) {
        JSONObject obj = new JSONObject();
        putIfPresent(obj, "service", v.service());
        putIfPresent(obj, "camera", v.camera());
        obj.put("objectTypes", new JSONArray(v.objectTypes()));
        if (v.minConfidence() != null) {
            obj.put("minConfidence", v.minConfidence().doubleValue());
        }
        putIfPresent(obj, "zone", v.zone());
        putIfPresent(obj, "imageSource", v.imageSource());
        if (v.checkInterval() != null) {
            obj.put("checkInterval", v.checkInterval().longValue());
        }
        return obj;
    }

    JSONArray encodeConditions(List<RoutineCondition> conditions) {
        JSONArray arr = new JSONArray();
        for (RoutineCondition c : conditions) {
            JSONObject obj = new JSONObject();
            putIfPresent(obj, "type", c.type());
            obj.put("config", JsonValues.toJson(c.config()));
            arr.put(obj);
        }
        return arr;
    }

    JSONArray encodeActions(List<RoutineAction> actions) {
        JSONArray arr = new JSONArray();
        for (RoutineAction a : actions) {
            JSONObject obj = new JSONObject();
            putIfPresent(obj, "type", a.type());
            putIfPresent(obj, "service", a.service());
            putIfPresent(obj, "method", a.method());
            if (!a.parameters().isEmpty()) {
                obj.put("parameters", JsonValues.toJson(a.parameters()));
            }
            arr.put(obj);
        }
        return arr;
    }

    private static void putIfPresent(JSONObject obj, String key, String value) {
        if (value != null) {
            obj.put(key, value);
        }
    }

    // ---- decoding ----

    RoutineTrigger decodeTrigger(Object raw, String recordId) {
        JSONObject obj = parseObject(raw, TRIGGER, recordId);
        if (obj == null) {
            return new RoutineTrigger(null, null);
        }
        JSONObject config = obj.optJSONObject("config");
        if (config == null) {
            return new RoutineTrigger(JsonValues.optText(obj, "type"), null);
        }
        TriggerConfig.Builder b = TriggerConfig.builder()
                .schedule(JsonValues.optText(config, "schedule"))
                .eventName(JsonValues.optText(config, "eventName"))
                .actionType(JsonValues.optText(config, "actionType"))
                .taskPattern(JsonValues.optText(config, "taskPattern"));
        JSONObject monitor = config.optJSONObject("monitor");
        if (monitor != null) {
            b.monitor(new Monitor(JsonValues.optText(monitor, "service"),
                    JsonValues.optText(monitor, "entity"),
                    JsonValues.optText(monitor, "property")));
        }
        JSONObject vision = config.optJSONObject("visionDetection");
        if (vision != null) {
            b.visionDetection(decodeVision(vision));
        }
        for (String key : config.keySet()) {
            if (!KNOWN_TRIGGER_KEYS.contains(key)) {
                b.extra(key, JsonValues.fromJson(config.opt(key)));
            }
        }
        return new RoutineTrigger(JsonValues.optText(obj, "type"), b.build());
    }

    private static VisionDetectionConfig decodeVision(JSONObject v) {
        List<String> objectTypes = new ArrayList<>();
        JSONArray types = v.optJSONArray("objectTypes");
        if (types != null) {
            for (int i = 0; i < types.length(); i++) {
                String t = types.optString(i, null);
                if (t != null) {
                    objectTypes.add(t);
                }
            }
        }
        Double minConfidence = v.has("minConfidence") && !v.isNull("minConfidence")
                ? v.optDouble("minConfidence") : null;
        Long checkInterval = v.has("checkInterval") && !v.isNull("checkInterval")
                ? v.optLong("checkInterval") : null;
        return new VisionDetectionConfig(
                JsonValues.optText(v, "service"),
                JsonValues.optText(v, "camera"),
                objectTypes,
                minConfidence,
                JsonValues.optText(v, "zone"),
                JsonValues.optText(v, "imageSource"),
                checkInterval);
    }

    List<RoutineCondition> decodeConditions(Object raw, String recordId) {
        JSONArray arr = parseArray(raw, CONDITIONS, recordId);
        List<RoutineCondition> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject obj = arr.optJSONObject(i);
            if (obj == null) {
                continue;
            }
            JSONObject config = obj.optJSONObject("config");
            out.add(new RoutineCondition(JsonValues.optText(obj, "type"),
                    config == null ? Map.of() : JsonValues.toMap(config)));
        }
        return out;
    }

    List<RoutineAction> decodeActions(Object raw, String recordId) {
        JSONArray arr = parseArray(raw, ACTIONS, recordId);
        List<RoutineAction> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject obj = arr.optJSONObject(i);
            if (obj == null) {
                continue;
            }
            JSONObject params = obj.optJSONObject("parameters");
            out.add(new RoutineAction(
                    JsonValues.optText(obj, "type"),
                    JsonValues.optText(obj, "service"),
                    JsonValues.optText(obj, "method"),
                    params == null ? Map.of() : JsonValues.toMap(params)));
        }
        return out;
    }

    private static JSONObject parseObject(Object raw, String key, String recordId) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map<?, ?> map) {
            return (JSONObject) JsonValues.toJson(map);
        }
        try {
            return new JSONObject(raw.toString());
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed {} in routine record {}: {}", key, recordId, e.getMessage());
            return null;
        }
    }

    private static JSONArray parseArray(Object raw, String key, String recordId) {
        if (raw == null) {
            return new JSONArray();
        }
        if (raw instanceof Collection<?> items) {
            return (JSONArray) JsonValues.toJson(items);
        }
        try {
            return new JSONArray(raw.toString());
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed {} in routine record {}: {}", key, recordId, e.getMessage());
            return new JSONArray();
        }
    }

    private static List<String> decodeTags(Object raw) {
        if (raw instanceof Collection<?> items) {
            List<String> tags = new ArrayList<>();
            for (Object item : items) {
                if (item != null) {
                    tags.add(item.toString());
                }
            }
            return tags;
        }
        if (raw instanceof String s && !s.isBlank()) {
            List<String> tags = new ArrayList<>();
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    tags.add(part.trim());
                }
            }
            return tags;
        }
        return List.of();
    }

    private static String textOr(Object raw, String fallback) {
        return raw == null ? fallback : raw.toString();
    }

    private static boolean booleanOr(Object raw, boolean fallback) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return fallback;
    }

    private static long longOr(Object raw, long fallback) {
        if (raw instanceof Number n) {
            return n.longValue();
        }
        if (raw instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static Instant instantOr(Object raw, Instant fallback) {
        if (raw instanceof Instant i) {
            return i;
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Instant.parse(s.trim());
            } catch (DateTimeParseException e) {
                LOG.debug("Unparseable timestamp '{}', using fallback", s);
                return fallback;
            }
        }
        return fallback;
    }
}
