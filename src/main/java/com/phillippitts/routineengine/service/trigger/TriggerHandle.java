package com.phillippitts.routineengine.service.trigger;

import com.phillippitts.routineengine.domain.TriggerType;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The live mechanism owned by {@link TriggerManager} for one routine.
 */
public final class TriggerHandle {

    private final String routineId;
    private final TriggerType kind;
    private final ScheduledTick tick;
    private final AtomicBoolean active;
    private final Instant registeredAt;

    TriggerHandle(String routineId, TriggerType kind, ScheduledTick tick, AtomicBoolean active, Instant registeredAt) {
        this.routineId = routineId;
        this.kind = kind;
        this.tick = tick;
        this.active = active;
        this.registeredAt = registeredAt;
    }

    public String routineId() {
        return routineId;
    }

    public TriggerType kind() {
        return kind;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public boolean isActive() {
        return active.get();
    }

    void cancel() {
        active.set(false);
        tick.cancel();
    }
}
