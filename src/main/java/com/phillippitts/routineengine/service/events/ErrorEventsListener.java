package com.phillippitts.routineengine.service.events;

import com.phillippitts.routineengine.service.metrics.RoutineMetricsPublisher;
import com.phillippitts.routineengine.service.trigger.event.RoutineTriggerDroppedEvent;
import com.phillippitts.routineengine.service.trigger.event.TriggerPollFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for trigger error events. Throttled to one log line per key per minute so a
 * broken state source polled every few seconds does not flood the log. Metrics are recorded for
 * every event regardless of throttling.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final RoutineMetricsPublisher metrics;
    private final Clock clock;

    ErrorEventsListener(RoutineMetricsPublisher metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onPollFailed(TriggerPollFailedEvent e) {
        metrics.recordPollFailure(e.source());
        String key = "poll-" + e.routineId() + '-' + e.source();
        if (shouldLog(key)) {
            LOG.warn("Trigger poll failing: routine={}, source={}, reason={}. Check the {} connection.",
                    e.routineId(), e.source(), e.message(), e.source());
        }
    }

    @EventListener
    void onTriggerDropped(RoutineTriggerDroppedEvent e) {
        String key = "dropped-" + e.routineId() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Trigger fire dropped: routine={}, source={}, reason={}", e.routineId(), e.source(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
