package com.onboardpilot.orchestrator.sla;

import com.onboardpilot.orchestrator.model.PipelineStage;

import java.time.Instant;

/**
 * One SLA classification of a stage. Recomputed on every poll; only the
 * latest per stage is kept.
 */
public record SlaResult(
        PipelineStage        stage,
        SlaStatus            status,
        double               elapsedMinutes,
        double               remainingMinutes,
        Instant              predictedCompletion,
        double               breachProbability,
        int                  extensionsUsed,
        SlaConfig.Thresholds thresholds,
        Instant              evaluatedAt
) {
    /** Minutes past the (extended) breach threshold; zero if not breached. */
    public double minutesPastBreach() {
        return Math.max(0.0, elapsedMinutes - thresholds.breach());
    }
}
