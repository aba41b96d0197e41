package com.onboardpilot.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of one stage within a session.
 *
 * Transitions only move forward. Going back to WAITING is a reset and is
 * only done through {@code StageRegistry.resetStage}.
 */
public enum StageStatus {
    WAITING,
    PROCESSING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    ESCALATED;

    public boolean canTransitionTo(StageStatus next) {
        return allowedNext().contains(next);
    }

    private Set<StageStatus> allowedNext() {
        return switch (this) {
            case WAITING    -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED, TIMEOUT, ESCALATED);
            case FAILED     -> EnumSet.of(ESCALATED);
            case TIMEOUT    -> EnumSet.of(ESCALATED);
            case ESCALATED  -> EnumSet.of(COMPLETED);
            case COMPLETED  -> EnumSet.noneOf(StageStatus.class);
        };
    }
}
