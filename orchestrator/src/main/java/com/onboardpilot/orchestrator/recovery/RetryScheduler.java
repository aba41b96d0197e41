package com.onboardpilot.orchestrator.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Recovery delays as cancellable timers, tracked per session.
 *
 * A delay is a future completed by a {@link ScheduledExecutorService}
 * timer; nothing ever sleeps. {@link #cancelSession} cancels every pending
 * delay of a session, which completes its future with a
 * {@link java.util.concurrent.CancellationException}.
 */
@Component
public class RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private final ScheduledExecutorService timers;
    private final Map<UUID, Set<PendingDelay>> pending = new ConcurrentHashMap<>();

    private static final class PendingDelay {
        final CompletableFuture<Void> promise = new CompletableFuture<>();
        volatile ScheduledFuture<?>   timer;
    }

    public RetryScheduler(ScheduledExecutorService recoveryTimers) {
        this.timers = recoveryTimers;
    }

    /** A future that completes once {@code delay} has passed, unless the session is cancelled first. */
    public CompletableFuture<Void> delay(UUID sessionId, Duration delay) {
        PendingDelay p = new PendingDelay();
        Set<PendingDelay> forSession = pending.computeIfAbsent(sessionId, id -> ConcurrentHashMap.newKeySet());
        forSession.add(p);
        p.timer = timers.schedule(() -> {
            forSession.remove(p);
            p.promise.complete(null);
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return p.promise;
    }

    /**
     * Cancel every pending delay of a session.
     *
     * @return how many delays were cancelled
     */
    public int cancelSession(UUID sessionId) {
        Set<PendingDelay> forSession = pending.remove(sessionId);
        if (forSession == null) return 0;

        int cancelled = 0;
        for (PendingDelay p : forSession) {
            ScheduledFuture<?> timer = p.timer;
            if (timer != null) timer.cancel(false);
            if (p.promise.cancel(false)) cancelled++;
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending recovery delay(s) for session {}", cancelled, sessionId);
        }
        return cancelled;
    }

    public int pendingCount(UUID sessionId) {
        Set<PendingDelay> forSession = pending.get(sessionId);
        return forSession == null ? 0 : (int) forSession.stream().filter(p -> !p.promise.isDone()).count();
    }
}
