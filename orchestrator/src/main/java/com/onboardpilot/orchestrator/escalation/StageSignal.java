package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.StageStatus;
import com.onboardpilot.orchestrator.sla.SlaResult;
import com.onboardpilot.orchestrator.sla.StageCriticality;

/**
 * What the escalation engine knows about one stage.
 *
 * @param gateStatus status of the latest gate evaluation, null if never evaluated
 * @param sla        latest SLA classification, null if the stage never started
 *
 * Only a stage still in flight counts against its SLA: once COMPLETED, or
 * reset to WAITING, its last classification is history.
 */
public record StageSignal(
        PipelineStage    stage,
        StageStatus      status,
        StageCriticality criticality,
        int              errorCount,
        int              retryCount,
        GateStatus       gateStatus,
        SlaResult        sla
) {
    /** The SLA classification rules may act on; null once the stage is no longer in flight. */
    public SlaResult activeSla() {
        return status == StageStatus.COMPLETED || status == StageStatus.WAITING ? null : sla;
    }

    public boolean isSlaDegraded() {
        SlaResult active = activeSla();
        return active != null && active.status().isDegraded();
    }
}
