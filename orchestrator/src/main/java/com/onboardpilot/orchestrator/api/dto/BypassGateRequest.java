package com.onboardpilot.orchestrator.api.dto;

import com.onboardpilot.orchestrator.gate.BypassRequest;
import jakarta.validation.constraints.NotBlank;

/** Request body for POST /sessions/{id}/stages/{stage}/bypass. */
public record BypassGateRequest(
        @NotBlank String authorizationLevel,
        @NotBlank String reason,
        @NotBlank String requestedBy
) {
    public BypassRequest toBypass() {
        return new BypassRequest(authorizationLevel, reason, requestedBy);
    }
}
