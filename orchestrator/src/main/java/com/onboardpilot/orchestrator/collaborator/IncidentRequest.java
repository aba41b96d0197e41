package com.onboardpilot.orchestrator.collaborator;

import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.PipelineStage;

import java.util.UUID;

/** Context for an incident ticket. {@code stage} is null for session-wide problems. */
public record IncidentRequest(
        UUID            sessionId,
        PipelineStage   stage,
        EscalationLevel level,
        String          title,
        String          description
) {}
