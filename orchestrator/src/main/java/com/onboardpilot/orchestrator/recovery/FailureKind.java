package com.onboardpilot.orchestrator.recovery;

/**
 * Failure taxonomy, declared from least to most severe. When one report
 * carries several errors the most severe kind wins.
 */
public enum FailureKind {
    TRANSIENT,
    QUALITY_VIOLATION,
    RESOURCE_EXHAUSTION,
    DEPENDENCY_UNAVAILABLE,
    STATE_INCONSISTENCY,
    UNRECOVERABLE;

    public FailureKind mostSevere(FailureKind other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
