package com.phillippitts.routineengine.service.engine;

import com.phillippitts.routineengine.config.properties.RoutineEngineProperties;
import com.phillippitts.routineengine.config.properties.TriggerProperties;
import com.phillippitts.routineengine.domain.Routine;
import com.phillippitts.routineengine.domain.RoutineAction;
import com.phillippitts.routineengine.domain.RoutineTrigger;
import com.phillippitts.routineengine.service.store.InMemoryRoutineRecordStore;
import com.phillippitts.routineengine.service.store.RoutineRecordCodec;
import com.phillippitts.routineengine.service.store.RoutineRecordStore;
import com.phillippitts.routineengine.service.trigger.TriggerManager;
import com.phillippitts.routineengine.testutil.EventCapturingPublisher;
import com.phillippitts.routineengine.testutil.ManualTriggerScheduler;
import com.phillippitts.routineengine.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RoutineLifecycleTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final RoutineRecordCodec codec = new RoutineRecordCodec();
    private InMemoryRoutineRecordStore store;
    private ManualTriggerScheduler scheduler;
    private TriggerManager triggers;
    private RoutineEngineProperties props;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        store = new InMemoryRoutineRecordStore(clock);
        scheduler = new ManualTriggerScheduler();
        triggers = new TriggerManager(scheduler, new EventCapturingPublisher(), new TriggerProperties(),
                null, List.of(), clock);
        props = new RoutineEngineProperties();
    }

    private String persist(String name, RoutineTrigger trigger, boolean enabled) {
        Routine r = new Routine(null, name, "d", trigger, List.of(), List.of(RoutineAction.notification("x")),
                List.of(), enabled, 0, null, NOW, null);
        return store.addMemory(codec.toText(r), "system", "routine", "NIRVANA", 8, codec.toMetadata(r));
    }

    @Test
    void startRegistersEnabledRoutinesAndStopCancelsThem() {
        String hourly = persist("Hourly", RoutineTrigger.time("every hour"), true);
        String off = persist("Off", RoutineTrigger.time("daily"), false);
        store.addMemory("note", "user", "note", "NIRVANA", 1, Map.of("type", "note"));
        RoutineLifecycle lifecycle = new RoutineLifecycle(store, codec, triggers, props);

        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(triggers.registeredIds()).containsExactly(hourly);
        assertThat(triggers.isRegistered(off)).isFalse();

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(triggers.registeredCount()).isZero();
        assertThat(scheduler.live()).isEmpty();
    }

    @Test
    void autostartDisabledRegistersNothing() {
        persist("Hourly", RoutineTrigger.time("every hour"), true);
        props.setAutostart(false);
        RoutineLifecycle lifecycle = new RoutineLifecycle(store, codec, triggers, props);

        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(triggers.registeredCount()).isZero();
    }

    @Test
    void startIsIdempotent() {
        persist("Hourly", RoutineTrigger.time("every hour"), true);
        RoutineLifecycle lifecycle = new RoutineLifecycle(store, codec, triggers, props);

        lifecycle.start();
        lifecycle.start();

        assertThat(scheduler.scheduled()).hasSize(1);
    }

    @Test
    void storeFailureAtStartupIsLoggedNotThrown() {
        RoutineRecordStore failing = mock(RoutineRecordStore.class);
        when(failing.getRoutines(true)).thenThrow(new IllegalStateException("offline"));
        RoutineLifecycle lifecycle = new RoutineLifecycle(failing, codec, triggers, props);

        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(triggers.registeredCount()).isZero();
    }
}
