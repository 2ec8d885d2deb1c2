package com.phillippitts.routineengine.service.store;

import com.phillippitts.routineengine.domain.ConditionType;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.RoutineAction;
import com.phillippitts.routineengine.domain.RoutineCondition;
import com.phillippitts.routineengine.domain.RoutineTrigger;
import com.phillippitts.routineengine.domain.TriggerConfig;
import com.phillippitts.routineengine.domain.VisionDetectionConfig;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoutineRecordCodecTest {

    private static final Instant CREATED = Instant.parse("2026-02-01T07:00:00Z");
    private static final Instant WRITTEN = Instant.parse("2026-02-01T07:00:01Z");

    private final RoutineRecordCodec codec = new RoutineRecordCodec();

    private static MemoryRecord record(String id, Map<String, Object> metadata) {
        return new MemoryRecord(id, "text", "system", "routine", "NIRVANA", 8, WRITTEN, metadata);
    }

    @Test
    void fullRoutineSurvivesEncoding() {
        Routine routine = new Routine("r1", "Porch watch", "Alert on visitors",
                RoutineTrigger.visionDetection(new VisionDetectionConfig(
                        "frigate", "porch", List.of("person", "dog"), 0.65, "steps", null, 5000L)),
                List.of(RoutineCondition.timeRange(18, 23),
                        RoutineCondition.of(ConditionType.STATE_CHECK,
                                Map.of("entity", "alarm.home", "in", List.of("armed_home", "armed_away")))),
                List.of(RoutineAction.notification("Someone is at the door"),
                        RoutineAction.connectorCall("homeassistant", "call_service",
                                Map.of("domain", "light", "service", "turn_on",
                                        "data", Map.of("entity_id", "light.porch", "brightness", 255,
                                                "transition", 80L, "kelvin", 2700.0, "level", 0.35,
                                                "steps", List.of(1, 2.5, 3L))))),
                List.of("security", "evening"), false, 7, Instant.parse("2026-02-03T20:00:00Z"), CREATED, "task_9");

        Routine decoded = codec.fromRecord(record("r1", codec.toMetadata(routine)));

        assertThat(decoded).isEqualTo(routine);
        assertThat(decoded.actions()).containsExactlyElementsOf(routine.actions());
    }

    @Test
    void numberTypesAreCanonicalAfterDecoding() {
        RoutineAction action = RoutineAction.connectorCall("homeassistant", "call_service",
                Map.of("brightness", 80L, "ratio", 0.5, "count", 3, "whole", 12.0));
        Routine routine = new Routine("r2", "Dim", "d", RoutineTrigger.time("every hour"), List.of(),
                List.of(action), List.of(), true, 0, null, CREATED, null);

        Routine decoded = codec.fromRecord(record("r2", codec.toMetadata(routine)));

        assertThat(decoded.actions()).containsExactly(action);
        assertThat(decoded.actions().get(0).parameters())
                .containsEntry("brightness", 80L)
                .containsEntry("ratio", 0.5)
                .containsEntry("count", 3L)
                .containsEntry("whole", 12L);
    }

    @Test
    void metadataUsesRoutineKeys() {
        Routine routine = new Routine("r1", "Hourly", "desc", RoutineTrigger.time("every hour"), List.of(),
                List.of(RoutineAction.notification("x")), List.of("a"), true, 0, null, CREATED, null);

        Map<String, Object> md = codec.toMetadata(routine);

        assertThat(md).containsEntry("type", "routine")
                .containsEntry("routineName", "Hourly")
                .containsEntry("routineEnabled", true)
                .containsEntry("routineExecutionCount", 0L)
                .containsEntry("createdAt", CREATED.toString())
                .doesNotContainKey("lastExecuted")
                .doesNotContainKey("routineCreatedFromTask");
        JSONObject trigger = new JSONObject((String) md.get("routineTrigger"));
        assertThat(trigger.getString("type")).isEqualTo("time");
        assertThat(trigger.getJSONObject("config").getString("schedule")).isEqualTo("every hour");
    }

    @Test
    void textSummarisesRoutine() {
        Routine routine = new Routine("r1", "Hourly", "Stretch reminder", RoutineTrigger.time("every hour"),
                List.of(), List.of(RoutineAction.notification("a"), RoutineAction.notification("b")),
                List.of(), true, 0, null, CREATED, null);

        assertThat(codec.toText(routine)).isEqualTo(
                "Hourly\n\nStretch reminder\n\nTrigger: Time-based: every hour\nActions: 2 action(s)");
    }

    @Test
    void missingFieldsFallBackToDefaults() {
        Routine decoded = codec.fromRecord(record("old", Map.of("type", "routine")));

        assertThat(decoded.name()).isEqualTo(RoutineRecordCodec.UNTITLED);
        assertThat(decoded.description()).isEmpty();
        assertThat(decoded.enabled()).isTrue();
        assertThat(decoded.executionCount()).isZero();
        assertThat(decoded.createdAt()).isEqualTo(WRITTEN);
        assertThat(decoded.lastExecuted()).isNull();
        assertThat(decoded.actions()).isEmpty();
        assertThat(decoded.trigger().type()).isNull();
    }

    @Test
    void malformedJsonDecodesAsEmpty() {
        Map<String, Object> md = new LinkedHashMap<>();
        md.put("type", "routine");
        md.put("routineName", "Broken");
        md.put("routineTrigger", "{not json");
        md.put("routineActions", "[oops");
        md.put("routineExecutionCount", "many");
        md.put("lastExecuted", "yesterday");

        Routine decoded = codec.fromRecord(record("b", md));

        assertThat(decoded.name()).isEqualTo("Broken");
        assertThat(decoded.trigger().type()).isNull();
        assertThat(decoded.actions()).isEmpty();
        assertThat(decoded.executionCount()).isZero();
        assertThat(decoded.lastExecuted()).isNull();
    }

    @Test
    void toleratesLooselyTypedValues() {
        Map<String, Object> md = new LinkedHashMap<>();
        md.put("type", "routine");
        md.put("routineEnabled", "false");
        md.put("routineExecutionCount", 3);
        md.put("routineTags", "morning, work,");
        md.put("routineActions", List.of(Map.of("type", "notification", "parameters", Map.of("message", "hi"))));

        Routine decoded = codec.fromRecord(record("l", md));

        assertThat(decoded.enabled()).isFalse();
        assertThat(decoded.executionCount()).isEqualTo(3);
        assertThat(decoded.tags()).containsExactly("morning", "work");
        assertThat(decoded.actions()).containsExactly(RoutineAction.notification("hi"));
    }

    @Test
    void unknownTriggerKindAndExtraConfigRoundTrip() {
        RoutineTrigger geofence = new RoutineTrigger("geofence",
                TriggerConfig.builder().extra("radius", 150).extra("zone", "home").build());
        Routine routine = new Routine("g", "Arrive", "d", geofence, List.of(),
                List.of(RoutineAction.notification("Welcome")), List.of(), true, 0, null, CREATED, null);

        Routine decoded = codec.fromRecord(record("g", codec.toMetadata(routine)));

        assertThat(decoded.trigger().type()).isEqualTo("geofence");
        assertThat(decoded.trigger().config().extra()).containsEntry("radius", 150L).containsEntry("zone", "home");
    }

    @Test
    void recognisesRoutineRecordsOnly() {
        assertThat(codec.isRoutine(record("a", Map.of("type", "routine")))).isTrue();
        assertThat(codec.isRoutine(record("b", Map.of("type", "note")))).isFalse();
        assertThat(codec.isRoutine(record("c", Map.of()))).isFalse();
        assertThat(codec.isRoutine(null)).isFalse();
    }
}
