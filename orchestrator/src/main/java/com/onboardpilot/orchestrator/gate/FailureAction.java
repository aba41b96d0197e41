package com.onboardpilot.orchestrator.gate;

/**
 * What the pipeline does when a gate fails.
 *
 * BLOCK    - stop, escalate as CRITICAL, re-dispatch within the gate's retry budget
 * WARN     - escalate as WARNING, re-dispatch within the gate's retry budget
 * ESCALATE - stop and wait for an operator decision
 */
public enum FailureAction {
    BLOCK,
    WARN,
    ESCALATE
}
