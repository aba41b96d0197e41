package com.onboardpilot.orchestrator.registry;

import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SessionLocksTest {

    private final SessionLocks locks = new SessionLocks();

    @Test
    void call_nestedOnSameThread_isReentrant() {
        UUID id = UUID.randomUUID();

        String result = locks.call(id, () -> locks.call(id, () -> "inner"));

        assertThat(result).isEqualTo("inner");
    }

    @Test
    void isHeldByCurrentThread_onlyInsideTheLock() {
        UUID id = UUID.randomUUID();

        assertThat(locks.isHeldByCurrentThread(id)).isFalse();
        locks.run(id, () -> assertThat(locks.isHeldByCurrentThread(id)).isTrue());
        assertThat(locks.isHeldByCurrentThread(id)).isFalse();
    }

    @Test
    void call_sameSessionFromManyThreads_neverOverlaps() throws Exception {
        UUID id = UUID.randomUUID();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 100; n++) {
                        locks.run(id, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                        });
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void release_whileHeld_keepsTheLock() {
        UUID id = UUID.randomUUID();

        locks.run(id, () -> {
            locks.release(id);
            assertThat(locks.isHeldByCurrentThread(id)).isTrue();
        });
        locks.release(id);

        assertThat(locks.isHeldByCurrentThread(id)).isFalse();
    }
}
