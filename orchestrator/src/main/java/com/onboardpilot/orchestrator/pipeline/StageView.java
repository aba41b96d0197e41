package com.onboardpilot.orchestrator.pipeline;

import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.StageRecord;
import com.onboardpilot.orchestrator.model.StageStatus;

import java.time.Instant;
import java.util.List;

/** Copy of a {@link StageRecord} taken under the session lock. */
public record StageView(
        PipelineStage stage,
        int           position,
        StageStatus   status,
        Instant       startedAt,
        Instant       completedAt,
        double        progressPercent,
        int           errorCount,
        List<String>  errors,
        int           retryCount,
        int           extensionsUsed,
        String        outputPayload
) {
    public static StageView of(StageRecord r) {
        return new StageView(
                r.getStage(),
                r.getPosition(),
                r.getStatus(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getProgressPercent(),
                r.getErrorCount(),
                r.getErrors(),
                r.getRetryCount(),
                r.getExtensionsUsed(),
                r.getOutputPayload()
        );
    }
}
