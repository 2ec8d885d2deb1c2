package com.phillippitts.routineengine.presentation.controller;

import com.phillippitts.routineengine.domain.ActionResult;
import com.phillippitts.routineengine.domain.RoutineDefinition;
import com.phillippitts.routineengine.domain.RoutineExecution;
import com.phillippitts.routineengine.domain.RoutineSummary;
import com.phillippitts.routineengine.domain.RoutineUpdate;
import com.phillippitts.routineengine.domain.TriggerType;
import com.phillippitts.routineengine.exception.RoutineNotFoundException;
import com.phillippitts.routineengine.exception.RoutineStoreException;
import com.phillippitts.routineengine.exception.RoutineValidationException;
import com.phillippitts.routineengine.service.engine.RoutineEngine;
import com.phillippitts.routineengine.service.pattern.RoutinePatternDetector;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RoutineController.class)
class RoutineControllerTest {

    private static final Instant T = Instant.parse("2026-01-01T08:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private RoutineEngine engine;

    @MockBean
    private RoutinePatternDetector patterns;

    @Test
    void createBindsDefinitionAndReturnsId() throws Exception {
        when(engine.createRoutine(any())).thenReturn("routine_1");

        mvc.perform(post("/api/routines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Morning lights",
                                 "description": "Porch light at dawn",
                                 "trigger": {"type": "time", "config": {"schedule": "every day"}},
                                 "actions": [{"type": "notification", "parameters": {"message": "Good morning"}}],
                                 "tags": ["home"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("routine_1"));

        ArgumentCaptor<RoutineDefinition> captor = ArgumentCaptor.forClass(RoutineDefinition.class);
        verify(engine).createRoutine(captor.capture());
        RoutineDefinition def = captor.getValue();
        assertThat(def.name()).isEqualTo("Morning lights");
        assertThat(def.trigger().kind()).isEqualTo(TriggerType.TIME);
        assertThat(def.trigger().config().schedule()).isEqualTo("every day");
        assertThat(def.actions()).singleElement()
                .satisfies(a -> assertThat(a.parameters()).containsEntry("message", "Good morning"));
        assertThat(def.conditions()).isEmpty();
    }

    @Test
    void createRejectsInvalidDefinition() throws Exception {
        when(engine.createRoutine(any()))
                .thenThrow(new RoutineValidationException("actions", "Routine must have at least one action"));

        mvc.perform(post("/api/routines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"description\": \"y\", \"trigger\": {\"type\": \"event\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("RoutineValidationException"))
                .andExpect(jsonPath("$.details").value("Routine must have at least one action"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/routines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));
    }

    @Test
    void listPassesEnabledFilter() throws Exception {
        when(engine.getRoutines(true)).thenReturn(List.of(
                new RoutineSummary("routine_1", "Morning lights", "d", true, null, 2, List.of("home"))));

        mvc.perform(get("/api/routines").param("enabledOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("routine_1"))
                .andExpect(jsonPath("$[0].executionCount").value(2));
    }

    @Test
    void unknownRoutineIsNotFound() throws Exception {
        when(engine.requireRoutine("nope")).thenThrow(new RoutineNotFoundException("nope"));

        mvc.perform(get("/api/routines/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details").value("Routine with ID nope not found"));
    }

    @Test
    void patchAppliesPartialUpdate() throws Exception {
        mvc.perform(patch("/api/routines/routine_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\": false}"))
                .andExpect(status().isNoContent());

        ArgumentCaptor<RoutineUpdate> captor = ArgumentCaptor.forClass(RoutineUpdate.class);
        verify(engine).updateRoutine(eq("routine_1"), captor.capture());
        assertThat(captor.getValue().enabled()).isFalse();
        assertThat(captor.getValue().name()).isNull();
    }

    @Test
    void deleteReturnsNoContentAndStoreFailureIs503() throws Exception {
        mvc.perform(delete("/api/routines/routine_1")).andExpect(status().isNoContent());

        doThrow(new RoutineStoreException("Failed to delete routine routine_2"))
                .when(engine).deleteRoutine("routine_2");
        mvc.perform(delete("/api/routines/routine_2")).andExpect(status().isServiceUnavailable());
    }

    @Test
    void toggleReturnsNewState() throws Exception {
        when(engine.toggleRoutine("routine_1")).thenReturn(false);

        mvc.perform(post("/api/routines/routine_1/toggle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }

    @Test
    void executeDefaultsToManual() throws Exception {
        when(engine.executeRoutine("routine_1", true)).thenReturn(RoutineExecution.succeeded(
                "routine_1", "exec_1", T, T, List.of(ActionResult.ok("Notification sent"))));

        mvc.perform(post("/api/routines/routine_1/execute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executionId").value("exec_1"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.results[0].success").value(true));

        verify(engine).executeRoutine("routine_1", true);
    }

    @Test
    void patternsEndpointRunsDetection() throws Exception {
        when(patterns.detectPatterns()).thenReturn(List.of());

        mvc.perform(get("/api/routines/patterns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(patterns).detectPatterns();
    }
}
