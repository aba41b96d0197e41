package com.onboardpilot.orchestrator.api.dto;

import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.QualityGateRecord;

import java.time.Instant;
import java.util.List;

public record GateResultResponse(
        PipelineStage stage,
        int           attempt,
        GateStatus    status,
        boolean       passed,
        double        score,
        List<String>  criticalIssues,
        List<String>  warnings,
        String        bypassReason,
        Instant       evaluatedAt
) {
    public static GateResultResponse from(QualityGateRecord g) {
        return new GateResultResponse(
                g.getStage(),
                g.getAttempt(),
                g.getStatus(),
                g.isPassed(),
                g.getScore(),
                g.getCriticalIssues(),
                g.getWarnings(),
                g.getBypassReason(),
                g.getEvaluatedAt()
        );
    }
}
