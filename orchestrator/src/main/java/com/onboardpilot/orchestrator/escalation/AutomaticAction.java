package com.onboardpilot.orchestrator.escalation;

/**
 * Remediations a rule may run when it fires. Each runs at most once per event.
 */
public enum AutomaticAction {
    /** Stop auto-advancing the session; applied by the state machine. */
    PAUSE_PIPELINE,
    CREATE_INCIDENT,
    /** Ask operations to restart every dependency whose circuit is open. */
    RESTART_DEPENDENCY,
    NOTIFY_MANAGEMENT,
    FLAG_FOR_MANUAL_REVIEW
}
