package com.onboardpilot.orchestrator.escalation;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per (session, rule) fire window: how often the rule fired and when it
 * last did.
 *
 * {@link #tryFire} is a compare-and-set on an immutable {@link FireWindow},
 * so two concurrent evaluations of the same rule can never both win the
 * same window.
 */
@Component
public class CooldownTracker {

    private final Map<Key, AtomicReference<FireWindow>> windows = new ConcurrentHashMap<>();

    private record Key(UUID sessionId, String ruleId) {}

    record FireWindow(int count, Instant lastFiredAt) {
        static final FireWindow EMPTY = new FireWindow(0, null);
    }

    /**
     * Claim the right to fire {@code ruleId} for {@code sessionId} at {@code now}.
     *
     * @return true if this caller may fire; the window is advanced atomically
     */
    public boolean tryFire(UUID sessionId, String ruleId, Duration cooldown, int maxPerSession, Instant now) {
        AtomicReference<FireWindow> ref = windows.computeIfAbsent(
                new Key(sessionId, ruleId), k -> new AtomicReference<>(FireWindow.EMPTY));
        while (true) {
            FireWindow window = ref.get();
            if (window.count() >= maxPerSession) {
                return false;
            }
            if (window.lastFiredAt() != null && now.isBefore(window.lastFiredAt().plus(cooldown))) {
                return false;
            }
            if (ref.compareAndSet(window, new FireWindow(window.count() + 1, now))) {
                return true;
            }
        }
    }

    public int firedCount(UUID sessionId, String ruleId) {
        AtomicReference<FireWindow> ref = windows.get(new Key(sessionId, ruleId));
        return ref == null ? 0 : ref.get().count();
    }

    /** Forget every window of a session that will not be evaluated again. */
    public void clear(UUID sessionId) {
        windows.keySet().removeIf(key -> key.sessionId().equals(sessionId));
    }
}
