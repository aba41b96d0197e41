package com.onboardpilot.orchestrator.recovery;

public enum RecoveryStatus {
    /** Every action succeeded. */
    SUCCESS,
    /** The pipeline resumed but some remediation failed; the session continues degraded. */
    PARTIAL,
    FAILED
}
