package com.onboardpilot.orchestrator.api;

import com.onboardpilot.orchestrator.api.dto.BypassGateRequest;
import com.onboardpilot.orchestrator.api.dto.OperatorRequest;
import com.onboardpilot.orchestrator.api.dto.RecoveryResultResponse;
import com.onboardpilot.orchestrator.api.dto.SessionResponse;
import com.onboardpilot.orchestrator.api.dto.SlaExtensionRequest;
import com.onboardpilot.orchestrator.api.dto.StageOutcomeRequest;
import com.onboardpilot.orchestrator.api.dto.StartSessionRequest;
import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.pipeline.OutcomeReceipt;
import com.onboardpilot.orchestrator.pipeline.PipelineStateMachine;
import com.onboardpilot.orchestrator.pipeline.StageView;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for the session lifecycle.
 *
 * POST /sessions                                      - start onboarding for a subject
 * GET  /sessions/{id}                                 - full snapshot of one session
 * POST /sessions/{id}/cancel | /pause | /resume       - operator session controls
 * POST /sessions/{id}/stages/{stage}/outcome          - worker callback
 * POST /sessions/{id}/stages/{stage}/bypass           - force a failed gate open
 * POST /sessions/{id}/stages/{stage}/retry            - re-dispatch a failed stage
 * POST /sessions/{id}/stages/{stage}/sla-extensions   - extend a stage's SLA
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final PipelineStateMachine stateMachine;

    public SessionController(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    /**
     * Start a session.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sessions \
     *     -H "Content-Type: application/json" \
     *     -d '{"subjectId":"emp-1001"}'
     */
    @PostMapping
    public ResponseEntity<SessionResponse> start(@Valid @RequestBody StartSessionRequest req) {
        OnboardingSession session = stateMachine.startSession(req.subjectId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SessionResponse.from(stateMachine.getSessionSnapshot(session.getId())));
    }

    @GetMapping("/{id}")
    public SessionResponse get(@PathVariable UUID id) {
        return SessionResponse.from(stateMachine.getSessionSnapshot(id));
    }

    @PostMapping("/{id}/cancel")
    public SessionResponse cancel(@PathVariable UUID id, @RequestBody(required = false) OperatorRequest req) {
        stateMachine.cancel(id, describe(req));
        return get(id);
    }

    @PostMapping("/{id}/pause")
    public SessionResponse pause(@PathVariable UUID id, @RequestBody(required = false) OperatorRequest req) {
        stateMachine.pause(id, describe(req));
        return get(id);
    }

    @PostMapping("/{id}/resume")
    public SessionResponse resume(@PathVariable UUID id) {
        stateMachine.resume(id);
        return get(id);
    }

    // ------------------------------------------------------------------
    // Stage-level
    // ------------------------------------------------------------------

    /**
     * Worker callback. A repeated report of the same payload answers 200
     * with {@code duplicate=true} and changes nothing.
     */
    @PostMapping("/{id}/stages/{stage}/outcome")
    public OutcomeReceipt reportOutcome(@PathVariable UUID id,
                                        @PathVariable PipelineStage stage,
                                        @Valid @RequestBody StageOutcomeRequest req) {
        return stateMachine.reportStageOutcome(id, stage, req.toOutcome());
    }

    @PostMapping("/{id}/stages/{stage}/bypass")
    public OutcomeReceipt bypass(@PathVariable UUID id,
                                 @PathVariable PipelineStage stage,
                                 @Valid @RequestBody BypassGateRequest req) {
        return stateMachine.bypassGate(id, stage, req.toBypass());
    }

    @PostMapping("/{id}/stages/{stage}/retry")
    public RecoveryResultResponse retry(@PathVariable UUID id,
                                        @PathVariable PipelineStage stage,
                                        @Valid @RequestBody OperatorRequest req) {
        return RecoveryResultResponse.from(stateMachine.retryStage(id, stage, req.operator()));
    }

    @PostMapping("/{id}/stages/{stage}/sla-extensions")
    public StageView extendSla(@PathVariable UUID id,
                               @PathVariable PipelineStage stage,
                               @Valid @RequestBody SlaExtensionRequest req) {
        return stateMachine.extendSla(id, stage, req.extensionId());
    }

    private static String describe(OperatorRequest req) {
        if (req == null) return null;
        if (req.note() == null || req.note().isBlank()) {
            return req.operator() == null ? null : "by " + req.operator();
        }
        return req.operator() == null ? req.note() : req.note() + " (by " + req.operator() + ")";
    }
}
