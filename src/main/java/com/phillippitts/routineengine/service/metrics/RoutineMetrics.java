package com.phillippitts.routineengine.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for routine executions and trigger mechanisms.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Execution latency per trigger source (time, state_change, vision_detection, manual)</li>
 *   <li>Success, failure and condition-skip counts per source</li>
 *   <li>Dropped trigger ticks and failed trigger polls</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RoutineMetrics {

    private static final String EXECUTION_PREFIX = "routines.execution";
    private static final String TRIGGER_PREFIX = "routines.trigger";

    private final MeterRegistry registry;

    public RoutineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records execution latency for a trigger source.
     *
     * @param source        trigger source that started the run
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String source, long durationNanos) {
        Timer.builder(EXECUTION_PREFIX + ".latency")
                .description("Time taken to run a routine")
                .tag("source", source)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String source) {
        Counter.builder(EXECUTION_PREFIX + ".success")
                .description("Number of routine executions that ran their actions")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure category (not_found, disabled, condition_error, store_error, error)
     */
    public void incrementFailure(String source, String reason) {
        Counter.builder(EXECUTION_PREFIX + ".failure")
                .description("Number of failed routine executions")
                .tag("source", source)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSkipped(String source) {
        Counter.builder(EXECUTION_PREFIX + ".skipped")
                .description("Number of automatic executions skipped because conditions were not met")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void incrementDropped(String source, String reason) {
        Counter.builder(TRIGGER_PREFIX + ".dropped")
                .description("Number of trigger ticks dropped without running the routine")
                .tag("source", source)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementPollFailure(String source) {
        Counter.builder(TRIGGER_PREFIX + ".poll.failure")
                .description("Number of failed trigger polls")
                .tag("source", source)
                .register(registry)
                .increment();
    }
}
