package com.phillippitts.routineengine.service.metrics;

import com.phillippitts.routineengine.domain.RoutineExecution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Translates execution outcomes into {@link RoutineMetrics} calls.
 *
 * <p>All methods tolerate a missing {@link RoutineMetrics} so the engine can run without a meter
 * registry in tests.
 *
 * @see RoutineMetrics
 */
public final class RoutineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(RoutineMetricsPublisher.class);

    /**
     * No-op instance for tests and builder defaults.
     */
    public static final RoutineMetricsPublisher NOOP = new RoutineMetricsPublisher(null);

    private final RoutineMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public RoutineMetricsPublisher(RoutineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("RoutineMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records the outcome and latency of one execution.
     *
     * @param source        trigger source or {@code manual}
     * @param execution     finished execution
     * @param failureReason category used when the execution failed for a reason other than conditions
     * @param durationNanos wall time of the run
     */
    public void recordExecution(String source, RoutineExecution execution, String failureReason, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(source, durationNanos);
        if (execution.success()) {
            metrics.incrementSuccess(source);
        } else if (execution.skippedByConditions()) {
            metrics.incrementSkipped(source);
        } else {
            metrics.incrementFailure(source, failureReason == null ? "error" : failureReason);
        }
    }

    public void recordDropped(String source, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementDropped(source, reason);
    }

    public void recordPollFailure(String source) {
        if (metrics == null) {
            return;
        }
        metrics.incrementPollFailure(source);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
