package com.onboardpilot.orchestrator.registry;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantLock} per session. Every mutation of a session, by the
 * state machine, a recovery timer or an operator, runs inside it; different
 * sessions never contend.
 */
@Component
public class SessionLocks {

    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T call(UUID sessionId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(UUID sessionId, Runnable action) {
        call(sessionId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(UUID sessionId) {
        ReentrantLock lock = locks.get(sessionId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    /** Drop the lock of a finished session unless someone is still using it. */
    public void release(UUID sessionId) {
        locks.computeIfPresent(sessionId, (id, lock) ->
                lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }
}
