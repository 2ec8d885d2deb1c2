package com.phillippitts.routineengine.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutineTest {

    private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void normalisesMissingCollectionsAndTrigger() {
        Routine routine = new Routine("r1", "n", "d", null, null, null, null, true, 0, null, CREATED, null);

        assertThat(routine.trigger().kind()).isEqualTo(TriggerType.UNKNOWN);
        assertThat(routine.conditions()).isEmpty();
        assertThat(routine.actions()).isEmpty();
        assertThat(routine.tags()).isEmpty();
    }

    @Test
    void tagsAreDeduplicatedInOrder() {
        Routine routine = new Routine("r1", "n", "d", RoutineTrigger.event("e"), List.of(), List.of(),
                List.of("home", "morning", "home"), true, 0, null, CREATED, null);

        assertThat(routine.tags()).containsExactly("home", "morning");
    }

    @Test
    void collectionsAreDefensivelyCopied() {
        List<RoutineAction> actions = new ArrayList<>(List.of(RoutineAction.notification("a")));
        Map<String, Object> params = new HashMap<>(Map.of("message", "hi"));
        RoutineAction action = new RoutineAction("notification", null, null, params);
        actions.add(action);

        Routine routine = new Routine("r1", "n", "d", RoutineTrigger.event("e"), List.of(), actions,
                List.of(), true, 0, null, CREATED, null);
        actions.clear();
        params.put("message", "changed");

        assertThat(routine.actions()).hasSize(2);
        assertThat(action.parameters()).containsEntry("message", "hi");
    }

    @Test
    void rejectsNegativeCountAndMissingCreation() {
        assertThatThrownBy(() -> new Routine("r1", "n", "d", null, null, null, null, true, -1, null, CREATED, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Routine("r1", "n", "d", null, null, null, null, true, 0, null, null, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void viewsCarryRoutineFields() {
        Routine routine = new Routine("r1", "Lights", "Porch", RoutineTrigger.time("every hour"), List.of(),
                List.of(RoutineAction.notification("x")), List.of("home"), false, 3, CREATED, CREATED, "task_1");

        assertThat(routine.toSummary())
                .isEqualTo(new RoutineSummary("r1", "Lights", "Porch", false, CREATED, 3, List.of("home")));
        assertThat(routine.toDetail().trigger()).isEqualTo(routine.trigger());
        assertThat(routine.toDetail().createdFromTask()).isEqualTo("task_1");
    }

    @Test
    void triggerDescriptions() {
        assertThat(RoutineTrigger.time("every 5 minutes").describe()).isEqualTo("Time-based: every 5 minutes");
        assertThat(RoutineTrigger.time(null).describe()).isEqualTo("Time-based: No schedule");
        assertThat(RoutineTrigger.completion(null).describe()).isEqualTo("Task completion: Any task");
        assertThat(RoutineTrigger.stateChange("homeassistant", "light.porch", null).describe())
                .isEqualTo("State change: homeassistant");
        assertThat(RoutineTrigger.visionDetection("frigate", List.of("person", "car")).describe())
                .isEqualTo("Vision detection: frigate detecting person, car");
        assertThat(new RoutineTrigger("geofence", null).describe()).isEqualTo("Unknown trigger");
    }

    @Test
    void patternConfidenceMustBeAFraction() {
        assertThatThrownBy(() -> new RoutinePattern(RoutinePattern.Type.TEMPORAL, "d", 3, 1.5, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
