package com.phillippitts.routineengine.service.engine;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutineExecutionGuardTest {

    private final RoutineExecutionGuard guard = new RoutineExecutionGuard();

    @Test
    void secondAcquireFailsUntilReleased() {
        assertThat(guard.tryAcquire("r1")).isTrue();
        assertThat(guard.tryAcquire("r1")).isFalse();
        assertThat(guard.isInFlight("r1")).isTrue();

        guard.release("r1");

        assertThat(guard.isInFlight("r1")).isFalse();
        assertThat(guard.tryAcquire("r1")).isTrue();
    }

    @Test
    void sameIdAlwaysMapsToSameLock() {
        assertThat(guard.lockFor("routine-42")).isSameAs(guard.lockFor(new String("routine-42")));
    }

    @Test
    void manyDistinctIdsShareFixedSetOfLocks() {
        Set<ReentrantLock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 10_000; i++) {
            String id = UUID.randomUUID().toString();
            guard.withLock(id, () -> seen.add(guard.lockFor(id)));
        }
        assertThat(seen).hasSizeLessThanOrEqualTo(RoutineExecutionGuard.STRIPES);
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        assertThatThrownBy(() -> guard.withLock("r1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(guard.lockFor("r1").isLocked()).isFalse();
    }

    @Test
    void updatesUnderLockAreNotLost() throws Exception {
        AtomicInteger unsafeCounter = new AtomicInteger();
        int[] count = {0};
        CountDownLatch start = new CountDownLatch(1);
        CompletableFuture<?>[] workers = new CompletableFuture<?>[8];
        for (int w = 0; w < workers.length; w++) {
            workers[w] = CompletableFuture.runAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 500; i++) {
                    guard.withLock("r1", () -> {
                        int read = count[0];
                        unsafeCounter.incrementAndGet();
                        count[0] = read + 1;
                        return null;
                    });
                }
            });
        }
        start.countDown();
        CompletableFuture.allOf(workers).get(10, TimeUnit.SECONDS);

        assertThat(count[0]).isEqualTo(unsafeCounter.get()).isEqualTo(4000);
    }
}
