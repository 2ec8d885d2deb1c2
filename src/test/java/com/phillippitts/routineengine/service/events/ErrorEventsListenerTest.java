package com.phillippitts.routineengine.service.events;

import com.phillippitts.routineengine.service.metrics.RoutineMetrics;
import com.phillippitts.routineengine.service.metrics.RoutineMetricsPublisher;
import com.phillippitts.routineengine.service.trigger.event.RoutineTriggerDroppedEvent;
import com.phillippitts.routineengine.service.trigger.event.TriggerPollFailedEvent;
import com.phillippitts.routineengine.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorEventsListenerTest {

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private ErrorEventsListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        listener = new ErrorEventsListener(new RoutineMetricsPublisher(new RoutineMetrics(registry)), clock);
    }

    @Test
    void throttlesPerKeyForOneMinute() {
        assertThat(listener.shouldLog("k")).isTrue();
        assertThat(listener.shouldLog("k")).isFalse();
        assertThat(listener.shouldLog("other")).isTrue();

        clock.advance(Duration.ofSeconds(60));
        assertThat(listener.shouldLog("k")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(listener.shouldLog("k")).isTrue();
    }

    @Test
    void countsEveryPollFailureEvenWhenLogThrottled() {
        TriggerPollFailedEvent event = new TriggerPollFailedEvent("r1", "state_change", clock.instant(),
                "Trigger poll failed", new IllegalStateException("down"));

        listener.onPollFailed(event);
        listener.onPollFailed(event);

        assertThat(registry.get("routines.trigger.poll.failure").tag("source", "state_change").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void droppedEventsAreThrottledPerReason() {
        listener.onTriggerDropped(new RoutineTriggerDroppedEvent("r1", "time", clock.instant(), "in_flight"));

        assertThat(listener.shouldLog("dropped-r1-in_flight")).isFalse();
        assertThat(listener.shouldLog("dropped-r1-not_found")).isTrue();
    }
}
