package com.onboardpilot.orchestrator.sla;

public enum SlaStatus {
    ON_TIME,
    AT_RISK,
    BREACHED,
    EXTENDED;

    /** AT_RISK and BREACHED both count towards compound degradation. */
    public boolean isDegraded() {
        return this == AT_RISK || this == BREACHED;
    }
}
