package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.PipelineStage;

import java.util.UUID;

/**
 * An escalation raised by the pipeline itself rather than matched from the
 * rule table: gate outcomes and unrecoverable failures.
 */
public record DirectEscalation(
        UUID            sessionId,
        String          subjectId,
        PipelineStage   stage,
        EscalationType  type,
        EscalationLevel level,
        String          reason,
        boolean         requiresAck
) {
    /** Synthetic rule id under which the event is stored. */
    public String ruleId() {
        return "direct_" + type.name().toLowerCase();
    }
}
