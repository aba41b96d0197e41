package com.onboardpilot.orchestrator.registry;

import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.QualityGateRecord;
import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.model.StageRecord;
import com.onboardpilot.orchestrator.repository.EscalationEventRepository;
import com.onboardpilot.orchestrator.repository.QualityGateRecordRepository;
import com.onboardpilot.orchestrator.repository.RecoveryAttemptRepository;
import com.onboardpilot.orchestrator.repository.SessionRepository;
import com.onboardpilot.orchestrator.repository.StageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed registry. Schema is owned by Flyway (V1 migration);
 * Hibernate only validates it.
 */
@Component
@ConditionalOnProperty(name = "onboardpilot.registry.type", havingValue = "jpa", matchIfMissing = true)
public class JpaStageRegistry implements StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(JpaStageRegistry.class);

    private final SessionRepository           sessionRepo;
    private final StageRecordRepository       stageRepo;
    private final QualityGateRecordRepository gateRepo;
    private final EscalationEventRepository   escalationRepo;
    private final RecoveryAttemptRepository   attemptRepo;

    public JpaStageRegistry(SessionRepository sessionRepo,
                            StageRecordRepository stageRepo,
                            QualityGateRecordRepository gateRepo,
                            EscalationEventRepository escalationRepo,
                            RecoveryAttemptRepository attemptRepo) {
        this.sessionRepo    = sessionRepo;
        this.stageRepo      = stageRepo;
        this.gateRepo       = gateRepo;
        this.escalationRepo = escalationRepo;
        this.attemptRepo    = attemptRepo;
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public OnboardingSession createSession(OnboardingSession session, List<StageRecord> stages) {
        OnboardingSession saved = sessionRepo.save(session);
        stageRepo.saveAll(stages);
        log.debug("Stored session {} with {} stages", saved.getId(), stages.size());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OnboardingSession> findSession(UUID sessionId) {
        return sessionRepo.findById(sessionId);
    }

    @Override
    @Transactional
    public OnboardingSession saveSession(OnboardingSession session) {
        return sessionRepo.save(session);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OnboardingSession> findSessionsByState(SessionState state) {
        return sessionRepo.findByStateOrderByStartedAtAsc(state);
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public List<StageRecord> stages(UUID sessionId) {
        return stageRepo.findBySessionIdOrderByPositionAsc(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StageRecord> stage(UUID sessionId, PipelineStage stage) {
        return stageRepo.findBySessionIdAndStage(sessionId, stage);
    }

    @Override
    @Transactional
    public StageRecord saveStage(StageRecord record) {
        return stageRepo.save(record);
    }

    @Override
    @Transactional
    public StageRecord resetStage(StageRecord record) {
        record.reset();
        log.info("Stage {} of session {} reset to WAITING", record.getStage(), record.getSessionId());
        return stageRepo.save(record);
    }

    // ------------------------------------------------------------------
    // Gate results / escalations / recovery
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public QualityGateRecord saveGateResult(QualityGateRecord record) {
        return gateRepo.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QualityGateRecord> gateResults(UUID sessionId) {
        return gateRepo.findBySessionIdOrderByEvaluatedAtAscAttemptAsc(sessionId);
    }

    @Override
    @Transactional
    public EscalationEvent saveEscalation(EscalationEvent event) {
        return escalationRepo.save(event);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EscalationEvent> findEscalation(UUID eventId) {
        return escalationRepo.findById(eventId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EscalationEvent> escalations(UUID sessionId) {
        return escalationRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    @Override
    @Transactional
    public RecoveryAttempt saveAttempt(RecoveryAttempt attempt) {
        return attemptRepo.save(attempt);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecoveryAttempt> attempts(UUID sessionId) {
        return attemptRepo.findBySessionIdOrderByCompletedAtAscAttemptNumberAsc(sessionId);
    }
}
