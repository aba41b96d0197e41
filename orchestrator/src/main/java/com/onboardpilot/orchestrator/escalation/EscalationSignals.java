package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.circuit.CircuitSnapshot;

import java.util.List;
import java.util.UUID;

/**
 * Everything one escalation pass looks at, captured at a single point in time.
 */
public record EscalationSignals(
        UUID                  sessionId,
        String                subjectId,
        List<StageSignal>     stages,
        List<CircuitSnapshot> circuits,
        boolean               outsideBusinessHours
) {
    public EscalationSignals {
        stages   = stages == null ? List.of() : List.copyOf(stages);
        circuits = circuits == null ? List.of() : List.copyOf(circuits);
    }

    /** Stages whose SLA is AT_RISK or BREACHED. */
    public long stagesAtRisk() {
        return stages.stream().filter(StageSignal::isSlaDegraded).count();
    }
}
