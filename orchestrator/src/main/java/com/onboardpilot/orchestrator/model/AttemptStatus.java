package com.onboardpilot.orchestrator.model;

public enum AttemptStatus {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
