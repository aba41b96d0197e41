package com.onboardpilot.orchestrator.circuit;

import java.time.Instant;

/**
 * Immutable view of one circuit. Published after every write so readers
 * never need the write lock.
 *
 * @param failureCount  consecutive unhealthy outcomes while CLOSED, total since opening otherwise
 * @param successCount  consecutive healthy probes while HALF_OPEN
 * @param halfOpenCalls probe calls handed out since entering HALF_OPEN
 */
public record CircuitSnapshot(
        String       serviceName,
        CircuitState state,
        int          failureCount,
        int          successCount,
        int          halfOpenCalls,
        Instant      lastFailureAt,
        Instant      openedAt,
        Instant      lastTransitionAt
) {
    static CircuitSnapshot closed(String serviceName, Instant now) {
        return new CircuitSnapshot(serviceName, CircuitState.CLOSED, 0, 0, 0, null, null, now);
    }

    public boolean isOpen() {
        return state == CircuitState.OPEN;
    }
}
