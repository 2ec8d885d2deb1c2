package com.phillippitts.routineengine.service.engine;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-routine concurrency control.
 *
 * <ul>
 *   <li>In-flight slots: at most one holder per routine id; a second {@link #tryAcquire(String)} fails
 *       until {@link #release(String)}.</li>
 *   <li>Bookkeeping locks: read-modify-write of a routine record runs under the lock of its id's
 *       stripe so that concurrent count updates are not lost. The stripe count is fixed, so ids never
 *       seen again (deleted routines, unknown ids) hold no memory.</li>
 * </ul>
 */
final class RoutineExecutionGuard {

    static final int STRIPES = 64;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    RoutineExecutionGuard() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    boolean tryAcquire(String routineId) {
        return inFlight.add(routineId);
    }

    void release(String routineId) {
        inFlight.remove(routineId);
    }

    boolean isInFlight(String routineId) {
        return inFlight.contains(routineId);
    }

    <T> T withLock(String routineId, Supplier<T> action) {
        ReentrantLock lock = lockFor(routineId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String routineId) {
        return locks[Math.floorMod(routineId.hashCode(), STRIPES)];
    }
}
