package com.onboardpilot.orchestrator.model;

public enum EscalationLevel {
    WARNING,
    CRITICAL,
    EMERGENCY
}
