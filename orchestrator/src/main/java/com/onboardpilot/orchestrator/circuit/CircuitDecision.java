package com.onboardpilot.orchestrator.circuit;

/**
 * The circuit after an update, and what the caller should make of it.
 * {@code previousState} is read under the same lock as the update.
 */
public record CircuitDecision(CircuitState previousState,
                              CircuitSnapshot snapshot,
                              RecommendedAction recommendedAction) {

    public CircuitState state() {
        return snapshot.state();
    }

    public boolean transitioned() {
        return previousState != snapshot.state();
    }
}
