package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.model.EscalationLevel;

import java.util.List;

/**
 * Compound-degradation escalation that is not tied to any rule in the table.
 * Fires when at least {@code minDegradedStages} stages are AT_RISK or BREACHED.
 */
public record DynamicEscalationConfig(
        boolean         enabled,
        int             minDegradedStages,
        EscalationLevel level,
        List<String>    recipients,
        int             cooldownMinutes,
        int             maxPerSession
) {
    public DynamicEscalationConfig {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        level      = level == null ? EscalationLevel.CRITICAL : level;
    }

    public static DynamicEscalationConfig disabled() {
        return new DynamicEscalationConfig(false, 2, EscalationLevel.CRITICAL, List.of(), 30, 1);
    }
}
