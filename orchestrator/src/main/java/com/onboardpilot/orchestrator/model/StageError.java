package com.onboardpilot.orchestrator.model;

/**
 * One error reported by a worker stage. {@code code} drives failure
 * classification, {@code message} is kept for operators.
 */
public record StageError(String code, String message) {

    public StageError {
        code = code == null || code.isBlank() ? "UNKNOWN" : code.trim().toUpperCase();
        message = message == null ? "" : message;
    }
}
