package com.onboardpilot.orchestrator.circuit;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State machine for one dependency.
 *
 * Every write takes this circuit's lock, so updates for one service are
 * serialized while different services never contend. Reads go through the
 * volatile {@link #snapshot()} and take no lock.
 */
class ServiceCircuit {

    private final String        serviceName;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile CircuitSnapshot snapshot;

    ServiceCircuit(String serviceName, Instant now) {
        this.serviceName = serviceName;
        this.snapshot    = CircuitSnapshot.closed(serviceName, now);
    }

    CircuitSnapshot snapshot() {
        return snapshot;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    CircuitDecision recordOutcome(boolean healthy, Instant now, CircuitBreakerConfig cfg) {
        writeLock.lock();
        try {
            CircuitSnapshot s = snapshot;
            return switch (s.state()) {
                case CLOSED    -> onClosed(s, healthy, now, cfg);
                case OPEN      -> onOpen(s, now, cfg);
                case HALF_OPEN -> onHalfOpen(s, healthy, now, cfg);
            };
        } finally {
            writeLock.unlock();
        }
    }

    /** Time-based move from OPEN to HALF_OPEN, with no outcome attached. */
    CircuitDecision evaluate(Instant now, CircuitBreakerConfig cfg) {
        writeLock.lock();
        try {
            CircuitSnapshot s = snapshot;
            if (s.state() == CircuitState.OPEN) {
                return onOpen(s, now, cfg);
            }
            return new CircuitDecision(s.state(), s, RecommendedAction.NONE);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Ask to make a call. An OPEN circuit whose recovery timeout has passed
     * moves to HALF_OPEN and hands this caller one of the probe slots.
     *
     * @return the decision; {@code permitted} is false when the caller must fail fast
     */
    Permission tryAcquire(Instant now, CircuitBreakerConfig cfg) {
        writeLock.lock();
        try {
            CircuitSnapshot s = snapshot;
            CircuitState previous = s.state();
            RecommendedAction action = RecommendedAction.NONE;
            if (s.state() == CircuitState.OPEN) {
                CircuitDecision d = onOpen(s, now, cfg);
                action = d.recommendedAction();
                s = d.snapshot();
            }
            return switch (s.state()) {
                case CLOSED -> new Permission(true, previous, s, action);
                case OPEN   -> new Permission(false, previous, s, action);
                case HALF_OPEN -> {
                    if (s.halfOpenCalls() >= cfg.halfOpenMaxCalls()) {
                        yield new Permission(false, previous, s, action);
                    }
                    CircuitSnapshot next = copy(s, s.state(), s.failureCount(), s.successCount(),
                            s.halfOpenCalls() + 1, s.lastFailureAt(), s.openedAt(), s.lastTransitionAt());
                    publish(next);
                    yield new Permission(true, previous, next, action);
                }
            };
        } finally {
            writeLock.unlock();
        }
    }

    CircuitDecision reset(Instant now) {
        writeLock.lock();
        try {
            return decide(CircuitSnapshot.closed(serviceName, now), RecommendedAction.CLOSE_CIRCUIT);
        } finally {
            writeLock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Transitions (caller holds the lock)
    // ------------------------------------------------------------------

    private CircuitDecision onClosed(CircuitSnapshot s, boolean healthy, Instant now, CircuitBreakerConfig cfg) {
        if (healthy) {
            if (s.failureCount() == 0) return new CircuitDecision(s.state(), s, RecommendedAction.NONE);
            return decide(copy(s, CircuitState.CLOSED, 0, 0, 0, s.lastFailureAt(), null, s.lastTransitionAt()),
                    RecommendedAction.NONE);
        }
        int failures = s.failureCount() + 1;
        if (failures >= cfg.failureThreshold()) {
            return decide(copy(s, CircuitState.OPEN, failures, 0, 0, now, now, now),
                    RecommendedAction.OPEN_CIRCUIT);
        }
        return decide(copy(s, CircuitState.CLOSED, failures, 0, 0, now, null, s.lastTransitionAt()),
                RecommendedAction.NONE);
    }

    private CircuitDecision onOpen(CircuitSnapshot s, Instant now, CircuitBreakerConfig cfg) {
        Instant since = s.openedAt() != null ? s.openedAt() : s.lastTransitionAt();
        if (Duration.between(since, now).compareTo(cfg.recoveryTimeout()) >= 0) {
            return decide(copy(s, CircuitState.HALF_OPEN, s.failureCount(), 0, 0, s.lastFailureAt(), s.openedAt(), now),
                    RecommendedAction.TRANSITION_HALF_OPEN);
        }
        // Still cooling down: outcomes are ignored, counters stay put.
        return new CircuitDecision(s.state(), s, RecommendedAction.NONE);
    }

    private CircuitDecision onHalfOpen(CircuitSnapshot s, boolean healthy, Instant now, CircuitBreakerConfig cfg) {
        if (!healthy) {
            return decide(copy(s, CircuitState.OPEN, s.failureCount() + 1, 0, 0, now, now, now),
                    RecommendedAction.REOPEN_CIRCUIT);
        }
        int successes = s.successCount() + 1;
        if (successes >= cfg.successThreshold()) {
            return decide(CircuitSnapshot.closed(serviceName, now), RecommendedAction.CLOSE_CIRCUIT);
        }
        return decide(copy(s, CircuitState.HALF_OPEN, s.failureCount(), successes, s.halfOpenCalls(),
                        s.lastFailureAt(), s.openedAt(), s.lastTransitionAt()),
                RecommendedAction.NONE);
    }

    private CircuitDecision decide(CircuitSnapshot next, RecommendedAction action) {
        CircuitState previous = snapshot.state();
        publish(next);
        return new CircuitDecision(previous, next, action);
    }

    private void publish(CircuitSnapshot next) {
        this.snapshot = next;
    }

    private CircuitSnapshot copy(CircuitSnapshot s, CircuitState state, int failures, int successes,
                                 int halfOpenCalls, Instant lastFailureAt, Instant openedAt,
                                 Instant lastTransitionAt) {
        return new CircuitSnapshot(s.serviceName(), state, failures, successes, halfOpenCalls,
                lastFailureAt, openedAt, lastTransitionAt);
    }

    record Permission(boolean permitted, CircuitState previousState,
                      CircuitSnapshot snapshot, RecommendedAction action) {

        CircuitDecision asDecision() {
            return new CircuitDecision(previousState, snapshot, action);
        }
    }
}
