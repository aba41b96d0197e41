package com.onboardpilot.orchestrator.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
