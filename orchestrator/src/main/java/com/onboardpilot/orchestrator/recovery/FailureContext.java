package com.onboardpilot.orchestrator.recovery;

import com.onboardpilot.orchestrator.model.PipelineStage;

import java.util.UUID;

/**
 * A flagged failure handed to the recovery orchestrator.
 *
 * @param errorCount    errors recorded on the stage (failed gate evaluations for quality violations)
 * @param priorAttempts retry attempts already spent on this stage
 * @param dependency    the dependency involved, or null when none is known
 */
public record FailureContext(
        UUID          sessionId,
        PipelineStage stage,
        FailureKind   kind,
        int           errorCount,
        int           priorAttempts,
        String        message,
        String        dependency
) {}
