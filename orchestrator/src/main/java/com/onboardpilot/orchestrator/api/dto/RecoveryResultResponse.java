package com.onboardpilot.orchestrator.api.dto;

import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.RecoveryStrategy;
import com.onboardpilot.orchestrator.recovery.RecoveryResult;
import com.onboardpilot.orchestrator.recovery.RecoveryStatus;

import java.util.List;

/** Response body for POST /sessions/{id}/stages/{stage}/retry. */
public record RecoveryResultResponse(
        PipelineStage                 stage,
        RecoveryStrategy              strategy,
        RecoveryStatus                status,
        boolean                       escalationRequired,
        String                        message,
        List<RecoveryAttemptResponse> attempts
) {
    public static RecoveryResultResponse from(RecoveryResult r) {
        return new RecoveryResultResponse(
                r.stage(),
                r.strategy(),
                r.status(),
                r.escalationRequired(),
                r.message(),
                r.attempts().stream().map(RecoveryAttemptResponse::from).toList()
        );
    }
}
