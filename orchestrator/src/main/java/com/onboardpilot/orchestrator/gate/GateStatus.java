package com.onboardpilot.orchestrator.gate;

public enum GateStatus {
    PASSED,
    FAILED,
    MANUAL_REVIEW,
    BYPASS;

    /** True for the two outcomes that let a stage complete. */
    public boolean allowsProgression() {
        return this == PASSED || this == BYPASS;
    }
}
