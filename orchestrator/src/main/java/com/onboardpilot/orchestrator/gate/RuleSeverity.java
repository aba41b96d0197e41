package com.onboardpilot.orchestrator.gate;

public enum RuleSeverity {
    INFO,
    WARNING,
    ERROR
}
