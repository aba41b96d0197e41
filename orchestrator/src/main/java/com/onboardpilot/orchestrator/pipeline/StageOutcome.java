package com.onboardpilot.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.onboardpilot.orchestrator.model.StageError;
import com.onboardpilot.orchestrator.model.StageStatus;

import java.util.List;

/**
 * What a worker reports about its stage.
 *
 * @param status   PROCESSING (progress update), COMPLETED or FAILED
 * @param payload  stage output; evaluated by the quality gate on COMPLETED
 * @param errors   reported errors; classified on FAILED
 * @param progress percent complete, or null when not reported
 */
public record StageOutcome(StageStatus status, JsonNode payload, List<StageError> errors, Double progress) {

    public StageOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static StageOutcome completed(JsonNode payload) {
        return new StageOutcome(StageStatus.COMPLETED, payload, List.of(), 100.0);
    }

    public static StageOutcome failed(List<StageError> errors) {
        return new StageOutcome(StageStatus.FAILED, null, errors, null);
    }

    public static StageOutcome progress(double percent) {
        return new StageOutcome(StageStatus.PROCESSING, null, List.of(), percent);
    }
}
