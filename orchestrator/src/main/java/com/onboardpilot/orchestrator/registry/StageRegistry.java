package com.onboardpilot.orchestrator.registry;

import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.QualityGateRecord;
import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.model.StageRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable per-session record of stages, gate results, escalations and
 * recovery attempts.
 *
 * Everything is partitioned by session id. Callers serialize writes to one
 * session themselves (see {@code SessionLocks}), so implementations need no
 * cross-session locking.
 *
 * Saves return the stored instance. Callers must continue with the
 * returned object, which may differ from the argument.
 */
public interface StageRegistry {

    // ── Sessions ──────────────────────────────────────────────────────────

    /** Store a new session together with its stage records. */
    OnboardingSession createSession(OnboardingSession session, List<StageRecord> stages);

    Optional<OnboardingSession> findSession(UUID sessionId);

    OnboardingSession saveSession(OnboardingSession session);

    List<OnboardingSession> findSessionsByState(SessionState state);

    // ── Stages ────────────────────────────────────────────────────────────

    /** All stages of a session, in pipeline order. */
    List<StageRecord> stages(UUID sessionId);

    Optional<StageRecord> stage(UUID sessionId, PipelineStage stage);

    StageRecord saveStage(StageRecord record);

    /**
     * Put a stage back to WAITING. The only way a stage status moves
     * backwards; reserved for the recovery orchestrator.
     */
    StageRecord resetStage(StageRecord record);

    // ── Gate results / escalations / recovery ─────────────────────────────

    QualityGateRecord saveGateResult(QualityGateRecord record);

    /** Gate results of a session, oldest first. */
    List<QualityGateRecord> gateResults(UUID sessionId);

    EscalationEvent saveEscalation(EscalationEvent event);

    Optional<EscalationEvent> findEscalation(UUID eventId);

    List<EscalationEvent> escalations(UUID sessionId);

    RecoveryAttempt saveAttempt(RecoveryAttempt attempt);

    /** Recovery attempts of a session in creation order. */
    List<RecoveryAttempt> attempts(UUID sessionId);
}
