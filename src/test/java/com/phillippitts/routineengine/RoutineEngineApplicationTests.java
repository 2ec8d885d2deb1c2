package com.phillippitts.routineengine;

import com.phillippitts.routineengine.domain.RoutineAction;
import com.phillippitts.routineengine.domain.RoutineDefinition;
import com.phillippitts.routineengine.domain.RoutineExecution;
import com.phillippitts.routineengine.domain.RoutineTrigger;
import com.phillippitts.routineengine.service.engine.RoutineEngine;
import com.phillippitts.routineengine.service.trigger.TriggerManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "routines.patterns.enabled=false",
        "routines.notification.desktop-enabled=false"
    }
)
class RoutineEngineApplicationTests {

    @Autowired
    private RoutineEngine engine;

    @Autowired
    private TriggerManager triggers;

    @Test
    void contextLoads() {
        assertThat(engine).isNotNull();
    }

    @Test
    void createdRoutineRunsThroughWiredEngine() {
        String id = engine.createRoutine(RoutineDefinition.of("Stretch", "Hourly reminder",
                RoutineTrigger.time("every hour"), List.of(RoutineAction.notification("Stand up and stretch"))));

        assertThat(triggers.isRegistered(id)).isTrue();

        RoutineExecution execution = engine.executeRoutine(id, true);

        assertThat(execution.success()).isTrue();
        assertThat(engine.requireRoutine(id).executionCount()).isEqualTo(1);

        engine.deleteRoutine(id);
        assertThat(triggers.isRegistered(id)).isFalse();
    }
}
