package com.phillippitts.routineengine.service.trigger;

/**
 * Cancellable handle of a periodic task returned by {@link TriggerScheduler}.
 */
public interface ScheduledTick {

    /**
     * Stops future runs. A run already in progress is not interrupted.
     */
    void cancel();

    boolean isCancelled();
}
