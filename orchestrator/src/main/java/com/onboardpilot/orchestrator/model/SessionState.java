package com.onboardpilot.orchestrator.model;

/**
 * Lifecycle of an onboarding session.
 *
 * INITIATED → RUNNING → FINALIZING → COMPLETED
 * RUNNING ⇄ PAUSED
 * any non-terminal state → FAILED_REQUIRES_RECOVERY | CANCELLED
 */
public enum SessionState {
    INITIATED,
    RUNNING,
    PAUSED,
    FINALIZING,
    COMPLETED,
    FAILED_REQUIRES_RECOVERY,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED_REQUIRES_RECOVERY || this == CANCELLED;
    }
}
