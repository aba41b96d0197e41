package com.onboardpilot.orchestrator.circuit;

public enum RecommendedAction {
    NONE,
    OPEN_CIRCUIT,
    TRANSITION_HALF_OPEN,
    CLOSE_CIRCUIT,
    REOPEN_CIRCUIT
}
