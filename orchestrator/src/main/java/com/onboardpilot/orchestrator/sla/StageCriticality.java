package com.onboardpilot.orchestrator.sla;

public enum StageCriticality {
    LOW,
    MEDIUM,
    HIGH
}
