package com.phillippitts.routineengine.service.trigger;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TriggerScheduler} backed by a Spring {@link TaskScheduler}.
 */
public class TaskSchedulerTriggerScheduler implements TriggerScheduler {

    private final TaskScheduler taskScheduler;

    public TaskSchedulerTriggerScheduler(TaskScheduler taskScheduler) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
    }

    @Override
    public ScheduledTick schedule(Runnable tick, Duration period, Duration initialDelay) {
        Instant start = taskScheduler.getClock().instant().plus(initialDelay);
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(tick, start, period);
        return new FutureTick(future);
    }

    private record FutureTick(ScheduledFuture<?> future) implements ScheduledTick {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
