package com.onboardpilot.orchestrator.pipeline;

import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.model.StageStatus;

import java.util.UUID;

/**
 * What happened to a reported outcome.
 *
 * @param duplicate  the same payload had already been evaluated; nothing changed
 * @param gateStatus status of the gate evaluation, null when no gate ran
 */
public record OutcomeReceipt(
        UUID          sessionId,
        PipelineStage stage,
        boolean       duplicate,
        StageStatus   stageStatus,
        GateStatus    gateStatus,
        SessionState  sessionState
) {}
