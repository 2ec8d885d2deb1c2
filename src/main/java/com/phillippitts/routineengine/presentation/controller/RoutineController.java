package com.phillippitts.routineengine.presentation.controller;

import com.phillippitts.routineengine.domain.RoutineDefinition;
import com.phillippitts.routineengine.domain.RoutineDetail;
import com.phillippitts.routineengine.domain.RoutineExecution;
import com.phillippitts.routineengine.domain.RoutinePattern;
import com.phillippitts.routineengine.domain.RoutineSummary;
import com.phillippitts.routineengine.domain.RoutineUpdate;
import com.phillippitts.routineengine.service.engine.RoutineEngine;
import com.phillippitts.routineengine.service.pattern.RoutinePatternDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface over {@link RoutineEngine}. Thin adapter: validation and error mapping happen in the
 * engine and {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/routines")
class RoutineController {

    private static final Logger LOG = LogManager.getLogger(RoutineController.class);

    private final RoutineEngine engine;
    private final RoutinePatternDetector patterns;

    RoutineController(RoutineEngine engine, RoutinePatternDetector patterns) {
        this.engine = engine;
        this.patterns = patterns;
    }

    @PostMapping
    ResponseEntity<Map<String, String>> create(@RequestBody RoutineDefinition definition) {
        String id = engine.createRoutine(definition);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @GetMapping
    List<RoutineSummary> list(@RequestParam(defaultValue = "false") boolean enabledOnly) {
        return engine.getRoutines(enabledOnly);
    }

    @GetMapping("/patterns")
    List<RoutinePattern> detectPatterns() {
        return patterns.detectPatterns();
    }

    @GetMapping("/{id}")
    RoutineDetail get(@PathVariable String id) {
        return engine.requireRoutine(id);
    }

    @PatchMapping("/{id}")
    ResponseEntity<Void> update(@PathVariable String id, @RequestBody RoutineUpdate update) {
        engine.updateRoutine(id, update);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable String id) {
        engine.deleteRoutine(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/toggle")
    Map<String, Object> toggle(@PathVariable String id) {
        boolean enabled = engine.toggleRoutine(id);
        return Map.of("id", id, "enabled", enabled);
    }

    @PostMapping("/{id}/execute")
    RoutineExecution execute(@PathVariable String id, @RequestParam(defaultValue = "true") boolean manual) {
        RoutineExecution execution = engine.executeRoutine(id, manual);
        LOG.info("Execution {} of routine {} via API: success={}", execution.executionId(), id, execution.success());
        return execution;
    }
}
