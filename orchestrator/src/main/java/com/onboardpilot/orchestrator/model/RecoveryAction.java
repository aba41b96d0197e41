package com.onboardpilot.orchestrator.model;

/** What a single recovery attempt actually did. */
public enum RecoveryAction {
    RETRY,
    STATE_RESTORE,
    CIRCUIT_RESET,
    WORKFLOW_RESUME,
    ESCALATE
}
