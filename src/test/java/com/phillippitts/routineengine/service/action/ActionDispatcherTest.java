package com.phillippitts.routineengine.service.action;

import com.phillippitts.routineengine.domain.ActionResult;
import com.phillippitts.routineengine.domain.ActionType;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.RoutineAction;
import com.phillippitts.routineengine.domain.RoutineTrigger;
import com.phillippitts.routineengine.service.connector.ConnectorRegistry;
import com.phillippitts.routineengine.service.connector.ConnectorResult;
import com.phillippitts.routineengine.testutil.RecordingConnectorHandler;
import com.phillippitts.routineengine.testutil.RecordingNotificationSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActionDispatcherTest {

    private RecordingConnectorHandler homeassistant;
    private RecordingNotificationSender notifications;
    private ActionDispatcher dispatcher;
    private Routine routine;

    @BeforeEach
    void setUp() {
        homeassistant = new RecordingConnectorHandler("homeassistant");
        notifications = new RecordingNotificationSender();
        dispatcher = new ActionDispatcher(new ConnectorRegistry(List.of(homeassistant)), notifications);
        routine = new Routine("r1", "Good Night", "Evening wind-down", RoutineTrigger.time("daily"),
                List.of(), List.of(RoutineAction.notification("x")), List.of(), true, 0, null,
                Instant.parse("2026-01-01T00:00:00Z"), null);
    }

    @Test
    void notificationUsesRoutineNameAsTitle() {
        List<ActionResult> results = dispatcher.run(List.of(RoutineAction.notification("Lights off")), routine);

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.success()).isTrue();
            assertThat(r.message()).isEqualTo("Lights off");
        });
        assertThat(notifications.sent()).containsExactly(
                new RecordingNotificationSender.Sent("Good Night", "Lights off"));
    }

    @Test
    void notificationWithoutMessageUsesDefaultText() {
        List<ActionResult> results = dispatcher.run(List.of(RoutineAction.notification(null)), routine);

        assertThat(results.get(0).message()).isEqualTo("Routine \"Good Night\" executed");
    }

    @Test
    void connectorCallPassesMethodAndParameters() {
        homeassistant.answering((method, params) -> ConnectorResult.ok(Map.of("state", "on")));

        List<ActionResult> results = dispatcher.run(List.of(RoutineAction.connectorCall(
                "homeassistant", "get_state", Map.of("entityId", "light.hall"))), routine);

        assertThat(homeassistant.calls()).singleElement().satisfies(call -> {
            assertThat(call.method()).isEqualTo("get_state");
            assertThat(call.parameters()).containsEntry("entityId", "light.hall");
        });
        assertThat(results.get(0).success()).isTrue();
        assertThat(results.get(0).message()).isEqualTo("homeassistant.get_state succeeded");
        assertThat(results.get(0).data()).isEqualTo(Map.of("state", "on"));
    }

    @Test
    void connectorCallWithoutMethodFails() {
        List<ActionResult> results = dispatcher.run(List.of(
                RoutineAction.connectorCall("homeassistant", " ", Map.of())), routine);

        assertThat(results.get(0).success()).isFalse();
        assertThat(results.get(0).error()).isEqualTo(ActionDispatcher.MISSING_SERVICE_OR_METHOD);
        assertThat(homeassistant.calls()).isEmpty();
    }

    @Test
    void stateChangeDefaultsToSetStateMethod() {
        dispatcher.run(List.of(RoutineAction.of(ActionType.STATE_CHANGE, "homeassistant",
                Map.of("entityId", "light.hall", "state", "off"))), routine);
        dispatcher.run(List.of(RoutineAction.of(ActionType.STATE_CHANGE, "homeassistant",
                Map.of("entityId", "light.hall", "method", "call_service"))), routine);

        assertThat(homeassistant.calls()).extracting(RecordingConnectorHandler.Call::method)
                .containsExactly("set_state", "call_service");
    }

    @Test
    void stateChangeWithoutServiceFails() {
        List<ActionResult> results = dispatcher.run(List.of(
                RoutineAction.of(ActionType.STATE_CHANGE, null, Map.of())), routine);

        assertThat(results.get(0).error()).isEqualTo(ActionDispatcher.STATE_CHANGE_REQUIRES_SERVICE);
    }

    @Test
    void unknownServiceFailsWithoutThrowing() {
        List<ActionResult> results = dispatcher.run(List.of(
                RoutineAction.connectorCall("calendar", "list", Map.of())), routine);

        assertThat(results.get(0).error()).isEqualTo("No handler found for service: calendar");
    }

    @Test
    void throwingHandlerBecomesFailedResult() {
        homeassistant.answering((m, p) -> {
            throw new IllegalStateException("HTTP 500");
        });

        List<ActionResult> results = dispatcher.run(List.of(
                RoutineAction.connectorCall("homeassistant", "call_service", Map.of()),
                RoutineAction.notification("after")), routine);

        assertThat(results).hasSize(2);
        assertThat(results.get(0).success()).isFalse();
        assertThat(results.get(0).error()).isEqualTo("HTTP 500");
        assertThat(results.get(1).success()).isTrue();
    }

    @Test
    void nullConnectorResultIsFailure() {
        homeassistant.answering((m, p) -> null);

        ActionResult result = dispatcher.run(List.of(
                RoutineAction.connectorCall("homeassistant", "get_state", Map.of())), routine).get(0);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Connector homeassistant returned no result");
    }

    @Test
    void setupRequiredIsCarriedIntoResult() {
        homeassistant.answering((m, p) -> ConnectorResult.setupRequired("Not configured", "Add a token"));

        ActionResult result = dispatcher.run(List.of(
                RoutineAction.connectorCall("homeassistant", "get_state", Map.of())), routine).get(0);

        assertThat(result.success()).isFalse();
        assertThat(result.requiresSetup()).isTrue();
        assertThat(result.setupInstructions()).isEqualTo("Add a token");
        assertThat(result.error()).isEqualTo("Not configured");
    }

    @Test
    void customAndUnknownActionsFail() {
        List<ActionResult> results = dispatcher.run(List.of(
                new RoutineAction("custom", null, null, Map.of()),
                new RoutineAction("play_music", null, null, Map.of())), routine);

        assertThat(results).extracting(ActionResult::error)
                .containsExactly("Unsupported action type: custom", "Unknown action type: play_music");
    }

    @Test
    void resultsKeepActionOrder() {
        List<ActionResult> results = dispatcher.run(List.of(
                RoutineAction.notification("one"),
                RoutineAction.connectorCall("nowhere", "x", Map.of()),
                RoutineAction.notification("three")), routine);

        assertThat(results).extracting(ActionResult::success).containsExactly(true, false, true);
        assertThat(notifications.messages()).containsExactly("one", "three");
    }
}
