package com.phillippitts.routineengine.service.trigger;

import java.time.Duration;

/**
 * Runs trigger ticks at a fixed rate. Production code delegates to a Spring task scheduler; tests
 * substitute a manually driven implementation.
 */
public interface TriggerScheduler {

    /**
     * @param tick         work to run each period
     * @param period       interval between runs
     * @param initialDelay delay before the first run ({@link Duration#ZERO} for immediate)
     */
    ScheduledTick schedule(Runnable tick, Duration period, Duration initialDelay);
}
