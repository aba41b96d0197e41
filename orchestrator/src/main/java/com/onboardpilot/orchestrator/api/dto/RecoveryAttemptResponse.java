package com.onboardpilot.orchestrator.api.dto;

import com.onboardpilot.orchestrator.model.AttemptStatus;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.RecoveryAction;
import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import com.onboardpilot.orchestrator.model.RecoveryStrategy;

import java.time.Instant;

/**
 * One recovery attempt. resultPayload is the JSON the orchestrator recorded
 * for the action (restored stages, reset circuits, escalation id).
 */
public record RecoveryAttemptResponse(
        PipelineStage    stage,
        RecoveryStrategy strategy,
        RecoveryAction   action,
        int              attemptNumber,
        AttemptStatus    status,
        Instant          startedAt,
        Instant          completedAt,
        double           durationSeconds,
        String           resultPayload,
        String           errorMessage
) {
    public static RecoveryAttemptResponse from(RecoveryAttempt a) {
        return new RecoveryAttemptResponse(
                a.getStage(),
                a.getStrategy(),
                a.getAction(),
                a.getAttemptNumber(),
                a.getStatus(),
                a.getStartedAt(),
                a.getCompletedAt(),
                a.getDurationSeconds(),
                a.getResultPayload(),
                a.getErrorMessage()
        );
    }
}
