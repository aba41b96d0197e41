package com.onboardpilot.orchestrator.pipeline;

import com.onboardpilot.orchestrator.circuit.CircuitSnapshot;
import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.QualityGateRecord;
import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.sla.SlaResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of one session, assembled under its lock so every part
 * describes the same moment.
 *
 * @param currentStage       null once the session has moved past its last stage
 * @param recoveryInProgress an automatic recovery is scheduled or running
 */
public record SessionSnapshot(
        UUID                    sessionId,
        String                  subjectId,
        SessionState            state,
        PipelineStage           currentStage,
        double                  overallProgress,
        boolean                 degraded,
        int                     workflowResumptions,
        String                  configVersion,
        String                  terminalReason,
        String                  terminalResult,
        Instant                 startedAt,
        Instant                 updatedAt,
        Instant                 completedAt,
        List<StageView>         stages,
        List<QualityGateRecord> qualityGateResults,
        List<SlaResult>         slaResults,
        List<CircuitSnapshot>   circuitStates,
        List<EscalationEvent>   escalationEvents,
        List<RecoveryAttempt>   recoveryAttempts,
        boolean                 recoveryInProgress
) {
    public SessionSnapshot {
        stages             = List.copyOf(stages);
        qualityGateResults = List.copyOf(qualityGateResults);
        slaResults         = List.copyOf(slaResults);
        circuitStates      = List.copyOf(circuitStates);
        escalationEvents   = List.copyOf(escalationEvents);
        recoveryAttempts   = List.copyOf(recoveryAttempts);
    }

    public StageView stage(PipelineStage stage) {
        return stages.stream()
                .filter(s -> s.stage() == stage)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Session has no stage " + stage));
    }
}
