package com.onboardpilot.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.onboardpilot.orchestrator.model.StageError;
import com.onboardpilot.orchestrator.model.StageStatus;
import com.onboardpilot.orchestrator.pipeline.StageOutcome;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request body for POST /sessions/{id}/stages/{stage}/outcome, sent by workers.
 *
 * Example:
 *   {"status":"COMPLETED","payload":{"employee_id":"E-1001","data_completeness":0.97}}
 *   {"status":"FAILED","errors":[{"code":"RATE_LIMITED","message":"HR API quota"}]}
 */
public record StageOutcomeRequest(
        @NotNull StageStatus status,
        JsonNode             payload,
        List<StageError>     errors,
        @DecimalMin("0.0") @DecimalMax("100.0") Double progress
) {
    public StageOutcome toOutcome() {
        return new StageOutcome(status, payload, errors, progress);
    }
}
