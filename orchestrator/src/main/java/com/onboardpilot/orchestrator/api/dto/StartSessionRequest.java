package com.onboardpilot.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /sessions.
 *
 * subjectId identifies the new employee in the upstream HR system.
 */
public record StartSessionRequest(@NotBlank String subjectId) {}
