package com.onboardpilot.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body for operator actions that only need to know who is acting, plus
 * optional free text (a pause or cancel reason, resolution notes).
 */
public record OperatorRequest(@NotBlank String operator, String note) {}
