package com.onboardpilot.orchestrator.model;

/**
 * Recovery strategies in priority order. The orchestrator picks the first
 * one that applies to a failure.
 */
public enum RecoveryStrategy {
    IMMEDIATE_RETRY,
    EXPONENTIAL_BACKOFF_RETRY,
    STATE_RESTORATION,
    WORKFLOW_RESUMPTION,
    ESCALATE_TO_HUMAN
}
