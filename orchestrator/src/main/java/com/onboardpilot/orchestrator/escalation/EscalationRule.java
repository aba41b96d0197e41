package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.model.EscalationLevel;

import java.util.List;

/**
 * A static escalation rule, bound from {@code onboardpilot.escalation.rules}.
 */
public record EscalationRule(
        String                id,
        String                name,
        EscalationType        type,
        EscalationLevel       level,
        TriggerConditions     trigger,
        List<String>          recipients,
        List<AutomaticAction> automaticActions,
        int                   cooldownMinutes,
        int                   maxPerSession,
        boolean               requiresAck,
        String                messageTemplate
) {
    public EscalationRule {
        recipients       = recipients == null ? List.of() : List.copyOf(recipients);
        automaticActions = automaticActions == null ? List.of() : List.copyOf(automaticActions);
        if (name == null || name.isBlank()) name = id;
        if (messageTemplate == null) messageTemplate = "";
    }
}
