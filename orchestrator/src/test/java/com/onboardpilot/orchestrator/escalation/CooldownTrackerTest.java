package com.onboardpilot.orchestrator.escalation;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownTrackerTest {

    private static final Duration COOLDOWN = Duration.ofMinutes(15);
    private static final Instant  T0       = Instant.parse("2026-03-02T10:00:00Z");

    private final CooldownTracker tracker = new CooldownTracker();
    private final UUID            session = UUID.randomUUID();

    @Test
    void tryFire_insideCooldown_isRefused() {
        assertThat(tracker.tryFire(session, "sla_at_risk", COOLDOWN, 3, T0)).isTrue();
        assertThat(tracker.tryFire(session, "sla_at_risk", COOLDOWN, 3, T0.plusSeconds(60))).isFalse();
        assertThat(tracker.firedCount(session, "sla_at_risk")).isEqualTo(1);
    }

    @Test
    void tryFire_exactlyAtCooldownEnd_isAllowed() {
        tracker.tryFire(session, "sla_at_risk", COOLDOWN, 3, T0);

        assertThat(tracker.tryFire(session, "sla_at_risk", COOLDOWN, 3, T0.plus(COOLDOWN))).isTrue();
    }

    @Test
    void tryFire_maxPerSessionReached_isRefusedForever() {
        for (int i = 0; i < 2; i++) {
            assertThat(tracker.tryFire(session, "dependency_outage", COOLDOWN, 2, T0.plus(COOLDOWN.multipliedBy(i))))
                    .isTrue();
        }

        assertThat(tracker.tryFire(session, "dependency_outage", COOLDOWN, 2, T0.plus(Duration.ofDays(1)))).isFalse();
    }

    @Test
    void tryFire_windowsAreKeyedBySessionAndRule() {
        UUID other = UUID.randomUUID();
        tracker.tryFire(session, "sla_at_risk", COOLDOWN, 1, T0);

        assertThat(tracker.tryFire(other, "sla_at_risk", COOLDOWN, 1, T0)).isTrue();
        assertThat(tracker.tryFire(session, "critical_sla_breach", COOLDOWN, 1, T0)).isTrue();
    }

    @Test
    void clear_forgetsOnlyThatSession() {
        UUID other = UUID.randomUUID();
        tracker.tryFire(session, "sla_at_risk", COOLDOWN, 1, T0);
        tracker.tryFire(other, "sla_at_risk", COOLDOWN, 1, T0);

        tracker.clear(session);

        assertThat(tracker.firedCount(session, "sla_at_risk")).isZero();
        assertThat(tracker.firedCount(other, "sla_at_risk")).isEqualTo(1);
    }

    @Test
    void tryFire_concurrentBurst_firesOncePerWindow() throws Exception {
        int threads = 32;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return tracker.tryFire(session, "critical_sla_breach", COOLDOWN, 3, T0);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> r : results) {
                if (r.get(5, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
