package com.onboardpilot.orchestrator.api.dto;

import com.onboardpilot.orchestrator.circuit.CircuitSnapshot;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.pipeline.SessionSnapshot;
import com.onboardpilot.orchestrator.pipeline.StageView;
import com.onboardpilot.orchestrator.sla.SlaResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /sessions and GET /sessions/{id}.
 *
 * terminalResult is the JSON written when the session ended: every stage's
 * last status, retry and error count.
 */
public record SessionResponse(
        UUID                          id,
        String                        subjectId,
        SessionState                  state,
        PipelineStage                 currentStage,
        double                        overallProgress,
        boolean                       degraded,
        int                           workflowResumptions,
        String                        configVersion,
        String                        terminalReason,
        String                        terminalResult,
        Instant                       startedAt,
        Instant                       updatedAt,
        Instant                       completedAt,
        boolean                       recoveryInProgress,
        List<StageView>               stages,
        List<GateResultResponse>      qualityGateResults,
        List<SlaResult>               slaResults,
        List<CircuitSnapshot>         circuitStates,
        List<EscalationResponse>      escalationEvents,
        List<RecoveryAttemptResponse> recoveryAttempts
) {
    public static SessionResponse from(SessionSnapshot s) {
        return new SessionResponse(
                s.sessionId(),
                s.subjectId(),
                s.state(),
                s.currentStage(),
                s.overallProgress(),
                s.degraded(),
                s.workflowResumptions(),
                s.configVersion(),
                s.terminalReason(),
                s.terminalResult(),
                s.startedAt(),
                s.updatedAt(),
                s.completedAt(),
                s.recoveryInProgress(),
                s.stages(),
                s.qualityGateResults().stream().map(GateResultResponse::from).toList(),
                s.slaResults(),
                s.circuitStates(),
                s.escalationEvents().stream().map(EscalationResponse::from).toList(),
                s.recoveryAttempts().stream().map(RecoveryAttemptResponse::from).toList()
        );
    }
}
