package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.circuit.CircuitState;
import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.model.StageStatus;
import com.onboardpilot.orchestrator.sla.SlaStatus;
import com.onboardpilot.orchestrator.sla.StageCriticality;

/**
 * When a rule fires. Every non-null condition must hold.
 *
 * Stage conditions must all hold for the same stage; session conditions are
 * checked once against the whole session. A rule with neither matches
 * nothing.
 */
public record TriggerConditions(
        // stage conditions
        SlaStatus        slaStatus,
        StageCriticality stageCriticality,
        Double           minBreachMinutes,
        GateStatus       gateStatus,
        Integer          minRetryAttempts,
        StageStatus      stageStatus,
        Integer          minErrorCount,
        // session conditions
        Integer          minStagesAtRisk,
        CircuitState     circuitState,
        Boolean          outsideBusinessHours
) {
    public boolean hasStageConditions() {
        return slaStatus != null || stageCriticality != null || minBreachMinutes != null
                || gateStatus != null || minRetryAttempts != null || stageStatus != null
                || minErrorCount != null;
    }

    public boolean hasSessionConditions() {
        return minStagesAtRisk != null || circuitState != null || outsideBusinessHours != null;
    }

    public boolean isEmpty() {
        return !hasStageConditions() && !hasSessionConditions();
    }
}
