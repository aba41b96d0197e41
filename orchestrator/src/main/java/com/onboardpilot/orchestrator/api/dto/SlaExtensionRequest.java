package com.onboardpilot.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body for POST /sessions/{id}/stages/{stage}/sla-extensions.
 * Re-sending the same extensionId is a no-op.
 */
public record SlaExtensionRequest(@NotBlank String extensionId) {}
