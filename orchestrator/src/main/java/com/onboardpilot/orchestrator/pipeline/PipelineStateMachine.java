package com.onboardpilot.orchestrator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.onboardpilot.orchestrator.circuit.CircuitBreakerManager;
import com.onboardpilot.orchestrator.circuit.DependencyUnavailableException;
import com.onboardpilot.orchestrator.collaborator.CollaboratorException;
import com.onboardpilot.orchestrator.collaborator.StageDispatcher;
import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.config.ResilienceConfiguration;
import com.onboardpilot.orchestrator.escalation.DirectEscalation;
import com.onboardpilot.orchestrator.escalation.EscalationOutcome;
import com.onboardpilot.orchestrator.escalation.EscalationRuleEngine;
import com.onboardpilot.orchestrator.escalation.EscalationSignals;
import com.onboardpilot.orchestrator.escalation.EscalationType;
import com.onboardpilot.orchestrator.escalation.StageSignal;
import com.onboardpilot.orchestrator.gate.BypassRequest;
import com.onboardpilot.orchestrator.gate.FailureAction;
import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.gate.QualityGateConfig;
import com.onboardpilot.orchestrator.gate.QualityGateEngine;
import com.onboardpilot.orchestrator.gate.QualityGateResult;
import com.onboardpilot.orchestrator.metrics.PipelineMetrics;
import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.QualityGateRecord;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.model.StageError;
import com.onboardpilot.orchestrator.model.StageRecord;
import com.onboardpilot.orchestrator.model.StageStatus;
import com.onboardpilot.orchestrator.recovery.ErrorClassifier;
import com.onboardpilot.orchestrator.recovery.FailureContext;
import com.onboardpilot.orchestrator.recovery.FailureKind;
import com.onboardpilot.orchestrator.recovery.RecoveryOrchestrator;
import com.onboardpilot.orchestrator.recovery.RecoveryResult;
import com.onboardpilot.orchestrator.recovery.RecoveryStatus;
import com.onboardpilot.orchestrator.recovery.RetryScheduler;
import com.onboardpilot.orchestrator.registry.SessionLocks;
import com.onboardpilot.orchestrator.registry.StageRegistry;
import com.onboardpilot.orchestrator.sla.SlaMonitor;
import com.onboardpilot.orchestrator.sla.SlaResult;
import com.onboardpilot.orchestrator.sla.SlaSnapshotStore;
import com.onboardpilot.orchestrator.sla.SlaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Drives one onboarding session through its ordered stages.
 *
 * <pre>
 *   INITIATED → RUNNING (stage 1 … stage n) → FINALIZING → COMPLETED
 *   RUNNING ⇄ PAUSED
 *   any non-terminal → FAILED_REQUIRES_RECOVERY | CANCELLED
 * </pre>
 *
 * A stage completes only through a PASSED or BYPASS gate result. Anything
 * else leaves it ESCALATED and hands the decision to escalation and
 * recovery. Every public operation runs inside the session's lock with
 * {@code sessionId} and {@code stage} in the MDC.
 */
@Service
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final StageRegistry         registry;
    private final SessionLocks          locks;
    private final ConfigurationRegistry config;
    private final QualityGateEngine     gates;
    private final SlaMonitor            slaMonitor;
    private final SlaSnapshotStore      slaStore;
    private final CircuitBreakerManager circuits;
    private final EscalationRuleEngine  escalations;
    private final RecoveryOrchestrator  recovery;
    private final RetryScheduler        retryScheduler;
    private final ErrorClassifier       classifier;
    private final StageDispatcher       dispatcher;
    private final PipelineMetrics       metrics;
    private final ObjectMapper          json;
    private final ObjectWriter          canonicalJson;
    private final Clock                 clock;

    // Latest automatic recovery per session; dropped when the session terminates.
    private final Map<UUID, CompletableFuture<RecoveryResult>> recoveries = new ConcurrentHashMap<>();

    public PipelineStateMachine(StageRegistry registry,
                                SessionLocks locks,
                                ConfigurationRegistry config,
                                QualityGateEngine gates,
                                SlaMonitor slaMonitor,
                                SlaSnapshotStore slaStore,
                                CircuitBreakerManager circuits,
                                EscalationRuleEngine escalations,
                                RecoveryOrchestrator recovery,
                                RetryScheduler retryScheduler,
                                ErrorClassifier classifier,
                                StageDispatcher dispatcher,
                                PipelineMetrics metrics,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.registry       = registry;
        this.locks          = locks;
        this.config         = config;
        this.gates          = gates;
        this.slaMonitor     = slaMonitor;
        this.slaStore       = slaStore;
        this.circuits       = circuits;
        this.escalations    = escalations;
        this.recovery       = recovery;
        this.retryScheduler = retryScheduler;
        this.classifier     = classifier;
        this.dispatcher     = dispatcher;
        this.metrics        = metrics;
        this.json           = objectMapper;
        this.canonicalJson  = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .writer();
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Session start
    // ------------------------------------------------------------------

    /**
     * Create a session with one WAITING record per configured stage and
     * dispatch the first stage.
     */
    public OnboardingSession startSession(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        ResilienceConfiguration cfg = config.current();
        Instant now = clock.instant();

        OnboardingSession created = new OnboardingSession(subjectId, cfg.version(), now);
        List<StageRecord> records = new ArrayList<>();
        for (int i = 0; i < cfg.stageCount(); i++) {
            records.add(new StageRecord(created.getId(), cfg.stageAt(i), i));
        }
        OnboardingSession stored = registry.createSession(created, records);
        metrics.sessionStarted();

        UUID id = stored.getId();
        return inLock(id, cfg.stageAt(0), () -> {
            OnboardingSession session = requireSession(id);
            session.setState(SessionState.RUNNING);
            session.touch(now);
            session = registry.saveSession(session);
            log.info("Session {} started for '{}' ({} stages, config '{}')",
                    id, subjectId, records.size(), cfg.version());

            dispatchStage(session, requireStage(id, cfg.stageAt(0)));
            return requireSession(id);
        });
    }

    // ------------------------------------------------------------------
    // Worker reports
    // ------------------------------------------------------------------

    /**
     * Apply a worker's report. The only external write path for stage
     * progress.
     *
     * @throws SessionNotFoundException         unknown session
     * @throws SessionClosedException           the session is terminal
     * @throws IllegalStageTransitionException  the report does not fit the stage's status
     */
    public OutcomeReceipt reportStageOutcome(UUID sessionId, PipelineStage stage, StageOutcome outcome) {
        return inLock(sessionId, stage, () -> {
            OnboardingSession session = requireOpenSession(sessionId);
            StageRecord record = requireStage(sessionId, stage);

            return switch (outcome.status()) {
                case PROCESSING -> reportProgress(session, record, outcome);
                case COMPLETED  -> reportCompleted(session, record, outcome);
                case FAILED     -> reportFailed(session, record, outcome);
                default -> throw new IllegalStageTransitionException(
                        "Workers may only report PROCESSING, COMPLETED or FAILED, not " + outcome.status());
            };
        });
    }

    private OutcomeReceipt reportProgress(OnboardingSession session, StageRecord record, StageOutcome outcome) {
        requireCurrentAndProcessing(session, record);
        if (outcome.progress() != null) {
            record.setProgressPercent(outcome.progress());
            record = registry.saveStage(record);
            updateProgress(session);
            registry.saveSession(session);
            log.debug("{} at {}%", record.getStage(), record.getProgressPercent());
        }
        return receipt(session, record, false, null);
    }

    private OutcomeReceipt reportCompleted(OnboardingSession session, StageRecord record, StageOutcome outcome) {
        String hash = payloadHash(outcome.payload());
        Optional<QualityGateRecord> latest = latestGateResult(session.getId(), record.getStage());

        if (record.getStatus() == StageStatus.COMPLETED || record.getStatus() == StageStatus.ESCALATED) {
            if (latest.isPresent() && latest.get().getPayloadHash().equals(hash)) {
                log.info("Duplicate report for {} ignored", record.getStage());
                return receipt(session, record, true, latest.get().getStatus());
            }
            throw new IllegalStageTransitionException(record.getStatus() == StageStatus.COMPLETED
                    ? "Stage " + record.getStage() + " already completed with a different payload"
                    : "Stage " + record.getStage() + " is ESCALATED; bypass or retry it first");
        }
        requireCurrentAndProcessing(session, record);

        if (outcome.progress() != null) {
            record.setProgressPercent(outcome.progress());
        }
        QualityGateResult result = evaluateGate(session, record, outcome.payload(), hash, null);
        return receipt(session, record, false, result.status());
    }

    private OutcomeReceipt reportFailed(OnboardingSession session, StageRecord record, StageOutcome outcome) {
        requireCurrentAndProcessing(session, record);
        Instant now = clock.instant();

        List<StageError> errors = outcome.errors().isEmpty()
                ? List.of(new StageError("UNKNOWN", "stage reported failure without errors"))
                : outcome.errors();
        record.transitionTo(StageStatus.FAILED, now);
        record.recordErrors(errors);
        if (outcome.payload() != null) {
            record.setOutputPayload(write(outcome.payload()));
        }
        record = registry.saveStage(record);
        metrics.stageTransition(record.getStage(), StageStatus.FAILED);

        FailureKind kind = classifier.classify(errors);
        String message = errors.stream().map(e -> e.code() + ": " + e.message()).collect(Collectors.joining("; "));
        log.warn("{} failed ({}): {}", record.getStage(), kind, message);

        runEscalation(session, now);
        if (session.getState() == SessionState.RUNNING) {
            startRecovery(session, record, kind, record.getErrorCount(), message, null);
        }
        return receipt(session, record, false, null);
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    /**
     * Re-evaluate the stored payload of an ESCALATED stage with a bypass.
     *
     * @throws BypassRejectedException when the gate does not grant the bypass
     */
    public OutcomeReceipt bypassGate(UUID sessionId, PipelineStage stage, BypassRequest bypass) {
        return inLock(sessionId, stage, () -> {
            OnboardingSession session = requireOpenSession(sessionId);
            StageRecord record = requireStage(sessionId, stage);
            if (record.getStatus() != StageStatus.ESCALATED) {
                throw new IllegalStageTransitionException(
                        "Only an ESCALATED stage can be bypassed; " + stage + " is " + record.getStatus());
            }

            JsonNode payload = read(record.getOutputPayload());
            QualityGateResult result = evaluateGate(session, record, payload, payloadHash(payload), bypass);
            if (!result.status().allowsProgression()) {
                String reason = result.warnings().stream()
                        .filter(w -> w.startsWith("bypass rejected: "))
                        .map(w -> w.substring("bypass rejected: ".length()))
                        .findFirst()
                        .orElse("gate is still " + result.status());
                throw new BypassRejectedException("Bypass of " + stage + " rejected: " + reason);
            }
            return receipt(session, record, false, result.status());
        });
    }

    /**
     * Re-dispatch an ESCALATED, FAILED or TIMEOUT stage on an operator's
     * request. Pending automatic retries for the session are cancelled first.
     */
    public RecoveryResult retryStage(UUID sessionId, PipelineStage stage, String operator) {
        return inLock(sessionId, stage, () -> {
            OnboardingSession session = requireOpenSession(sessionId);
            if (session.getState() != SessionState.RUNNING) {
                throw new SessionClosedException(sessionId, session.getState());
            }
            StageRecord record = requireStage(sessionId, stage);
            if (!isCurrent(session, record)) {
                throw new IllegalStageTransitionException(stage + " is not the current stage");
            }
            if (record.getStatus() != StageStatus.ESCALATED
                    && record.getStatus() != StageStatus.FAILED
                    && record.getStatus() != StageStatus.TIMEOUT) {
                throw new IllegalStageTransitionException(
                        "Only an ESCALATED, FAILED or TIMEOUT stage can be retried; " + stage + " is " + record.getStatus());
            }

            retryScheduler.cancelSession(sessionId);
            RecoveryResult result = recovery.retryNow(session, record, operator);
            if (result.status() != RecoveryStatus.SUCCESS) {
                log.warn("Operator retry of {} by '{}' could not dispatch: {}", stage, operator, result.message());
            }
            return result;
        });
    }

    /**
     * Apply an SLA extension. Re-applying the same {@code extensionId} changes nothing.
     *
     * @throws com.onboardpilot.orchestrator.sla.SlaExtensionRejectedException when no extension may be granted
     */
    public StageView extendSla(UUID sessionId, PipelineStage stage, String extensionId) {
        return inLock(sessionId, stage, () -> {
            requireOpenSession(sessionId);
            StageRecord record = requireStage(sessionId, stage);
            if (slaMonitor.extend(record, extensionId)) {
                record = registry.saveStage(record);
                if (record.getStartedAt() != null) {
                    slaStore.put(sessionId, slaMonitor.evaluate(record, clock.instant()));
                }
            }
            return StageView.of(record);
        });
    }

    public OnboardingSession pause(UUID sessionId, String reason) {
        return inLock(sessionId, null, () -> {
            OnboardingSession session = requireOpenSession(sessionId);
            if (session.getState() == SessionState.PAUSED) {
                return session;
            }
            if (session.getState() != SessionState.RUNNING) {
                throw new IllegalStageTransitionException("Cannot pause a session that is " + session.getState());
            }
            return pauseInternal(session, reason == null || reason.isBlank() ? "paused by operator" : reason);
        });
    }

    /**
     * Resume a paused session. A WAITING current stage is dispatched; a
     * FAILED or TIMEOUT one is re-dispatched. An ESCALATED stage stays with
     * the operator.
     */
    public OnboardingSession resume(UUID sessionId) {
        return inLock(sessionId, null, () -> {
            OnboardingSession session = requireOpenSession(sessionId);
            if (session.getState() == SessionState.RUNNING) {
                return session;
            }
            if (session.getState() != SessionState.PAUSED) {
                throw new IllegalStageTransitionException("Cannot resume a session that is " + session.getState());
            }
            session.setState(SessionState.RUNNING);
            session.touch(clock.instant());
            session = registry.saveSession(session);
            log.info("Session {} resumed", sessionId);

            Optional<StageRecord> current = currentRecord(session);
            if (current.isEmpty()) {
                return session;
            }
            StageRecord record = current.get();
            switch (record.getStatus()) {
                case WAITING -> dispatchStage(session, record);
                case FAILED, TIMEOUT -> {
                    RecoveryResult result = recovery.retryNow(session, record, "resume");
                    if (result.status() != RecoveryStatus.SUCCESS) {
                        StageRecord failed = requireStage(sessionId, record.getStage());
                        startRecovery(session, failed, classifier.classify(parseErrors(failed)),
                                failed.getErrorCount(), result.message(), StageDispatcher.SERVICE);
                    }
                }
                default -> log.debug("Current stage {} is {}; nothing to dispatch", record.getStage(), record.getStatus());
            }
            return requireSession(sessionId);
        });
    }

    /**
     * Cancel a session. Pending recovery timers are cancelled before this
     * returns. Cancelling a cancelled session is a no-op.
     */
    public OnboardingSession cancel(UUID sessionId, String reason) {
        return inLock(sessionId, null, () -> {
            OnboardingSession session = requireSession(sessionId);
            if (session.getState() == SessionState.CANCELLED) {
                return session;
            }
            if (session.isTerminal()) {
                throw new SessionClosedException(sessionId, session.getState());
            }
            return terminate(session, SessionState.CANCELLED,
                    reason == null || reason.isBlank() ? "cancelled by operator" : reason);
        });
    }

    // ------------------------------------------------------------------
    // Monitoring (called by PipelineScheduler)
    // ------------------------------------------------------------------

    /**
     * One monitoring pass over every RUNNING session: SLA evaluation,
     * escalation rules and timeouts. A failure for one session is logged and
     * does not stop the pass.
     */
    public int monitorActiveSessions() {
        List<OnboardingSession> running = registry.findSessionsByState(SessionState.RUNNING);
        int monitored = 0;
        for (OnboardingSession session : running) {
            try {
                monitor(session.getId());
                monitored++;
            } catch (RuntimeException e) {
                log.error("Monitoring pass failed for session {}", session.getId(), e);
            }
        }
        return monitored;
    }

    public void monitor(UUID sessionId) {
        inLock(sessionId, null, () -> {
            OnboardingSession session = requireSession(sessionId);
            if (session.getState() != SessionState.RUNNING) return null;

            Instant now = clock.instant();
            Optional<StageRecord> current = currentRecord(session);
            SlaResult sla = null;
            if (current.isPresent() && current.get().getStatus() == StageStatus.PROCESSING) {
                sla = slaMonitor.evaluate(current.get(), now);
                slaStore.put(sessionId, sla);
            }

            runEscalation(session, now);

            if (sla != null && isTimedOut(current.get(), sla)) {
                timeout(session, current.get(), sla);
            }
            return null;
        });
    }

    private boolean isTimedOut(StageRecord record, SlaResult sla) {
        if (sla.status() != SlaStatus.BREACHED || slaMonitor.canExtend(record)) return false;
        double limit = sla.thresholds().breach() + config.current().timeoutGraceMinutes();
        return sla.elapsedMinutes() > limit;
    }

    private void timeout(OnboardingSession session, StageRecord record, SlaResult sla) {
        String message = String.format("no outcome after %.1f minutes (breach at %.1f)",
                sla.elapsedMinutes(), sla.thresholds().breach());
        record.transitionTo(StageStatus.TIMEOUT, clock.instant());
        record.recordErrors(List.of(new StageError("TIMEOUT", message)));
        record = registry.saveStage(record);
        metrics.stageTransition(record.getStage(), StageStatus.TIMEOUT);
        log.warn("{} timed out: {}", record.getStage(), message);

        if (session.getState() == SessionState.RUNNING) {
            startRecovery(session, record, FailureKind.TRANSIENT, record.getErrorCount(), message, null);
        }
    }

    // ------------------------------------------------------------------
    // Snapshot
    // ------------------------------------------------------------------

    public SessionSnapshot getSessionSnapshot(UUID sessionId) {
        return locks.call(sessionId, () -> {
            OnboardingSession session = requireSession(sessionId);
            List<StageRecord> stages = registry.stages(sessionId);
            PipelineStage currentStage = session.getCurrentStageIndex() < stages.size()
                    ? stages.get(session.getCurrentStageIndex()).getStage()
                    : null;
            CompletableFuture<RecoveryResult> pending = recoveries.get(sessionId);
            boolean recovering = retryScheduler.pendingCount(sessionId) > 0
                    || (pending != null && !pending.isDone());

            return new SessionSnapshot(
                    session.getId(),
                    session.getSubjectId(),
                    session.getState(),
                    currentStage,
                    session.getOverallProgress(),
                    session.isDegraded(),
                    session.getWorkflowResumptions(),
                    session.getConfigVersion(),
                    session.getTerminalReason(),
                    session.getResultJson(),
                    session.getStartedAt(),
                    session.getUpdatedAt(),
                    session.getCompletedAt(),
                    stages.stream().map(StageView::of).toList(),
                    registry.gateResults(sessionId),
                    slaStore.latest(sessionId),
                    circuits.snapshots(),
                    registry.escalations(sessionId),
                    registry.attempts(sessionId),
                    recovering);
        });
    }

    /** The automatic recovery started most recently for a session, if any. */
    public Optional<CompletableFuture<RecoveryResult>> pendingRecovery(UUID sessionId) {
        return Optional.ofNullable(recoveries.get(sessionId));
    }

    // ------------------------------------------------------------------
    // Gate handling
    // ------------------------------------------------------------------

    private QualityGateResult evaluateGate(OnboardingSession session, StageRecord record,
                                           JsonNode payload, String hash, BypassRequest bypass) {
        UUID id = session.getId();
        PipelineStage stage = record.getStage();
        QualityGateResult result = gates.evaluate(stage, payload, bypass);

        int attempt = (int) registry.gateResults(id).stream().filter(g -> g.getStage() == stage).count() + 1;
        registry.saveGateResult(new QualityGateRecord(id, attempt, result, hash));
        record.setOutputPayload(payload == null ? null : write(payload));

        if (result.status().allowsProgression()) {
            completeStage(session, record);
            return result;
        }
        if (record.getStatus() != StageStatus.ESCALATED) {
            record.transitionTo(StageStatus.ESCALATED, clock.instant());
            metrics.stageTransition(stage, StageStatus.ESCALATED);
        }
        record = registry.saveStage(record);
        onGateFailure(session, record, result);
        return result;
    }

    private void onGateFailure(OnboardingSession session, StageRecord record, QualityGateResult result) {
        PipelineStage stage = record.getStage();
        QualityGateConfig gate = config.current().gate(stage);
        String issues = result.criticalIssues().isEmpty()
                ? String.join("; ", result.warnings())
                : String.join("; ", result.criticalIssues());
        String reason = "quality gate " + result.status() + " (score " + result.score() + ")"
                + (issues.isEmpty() ? "" : ": " + issues);

        if (bypassAttempted(result)) {
            // A rejected bypass changes nothing about the stage; no new escalation.
            log.warn("Bypass of {} rejected: {}", stage, reason);
            return;
        }

        if (result.status() == GateStatus.MANUAL_REVIEW) {
            escalateDirect(session, stage, EscalationLevel.WARNING, reason, true);
            log.warn("{} needs manual review: {}", stage, reason);
            runEscalation(session, clock.instant());
            return;
        }

        switch (gate.failureAction()) {
            case ESCALATE -> {
                escalateDirect(session, stage, EscalationLevel.CRITICAL, reason, true);
                log.warn("{} failed its gate and waits for an operator: {}", stage, reason);
                runEscalation(session, clock.instant());
            }
            case WARN, BLOCK -> {
                EscalationLevel level = gate.failureAction() == FailureAction.WARN
                        ? EscalationLevel.WARNING : EscalationLevel.CRITICAL;
                escalateDirect(session, stage, level, reason, false);
                runEscalation(session, clock.instant());

                if (session.getState() != SessionState.RUNNING) {
                    return;
                }
                if (record.getRetryCount() < gate.maxRetries()) {
                    int failedEvaluations = (int) registry.gateResults(session.getId()).stream()
                            .filter(g -> g.getStage() == stage && !g.getStatus().allowsProgression())
                            .count();
                    startRecovery(session, record, FailureKind.QUALITY_VIOLATION, failedEvaluations, reason, null);
                } else {
                    terminate(session, SessionState.FAILED_REQUIRES_RECOVERY,
                            "quality gate for " + stage + " still failing after "
                                    + record.getRetryCount() + " re-dispatches: " + reason);
                }
            }
        }
    }

    private static boolean bypassAttempted(QualityGateResult result) {
        return result.warnings().stream().anyMatch(w -> w.startsWith("bypass rejected: "));
    }

    // ------------------------------------------------------------------
    // Progression
    // ------------------------------------------------------------------

    private void completeStage(OnboardingSession session, StageRecord record) {
        Instant now = clock.instant();
        record.transitionTo(StageStatus.COMPLETED, now);
        record.checkpoint(now);
        record = registry.saveStage(record);
        metrics.stageTransition(record.getStage(), StageStatus.COMPLETED);
        if (record.getStartedAt() != null) {
            slaStore.put(session.getId(), slaMonitor.evaluate(record, now));
        }
        log.info("{} completed", record.getStage());
        advance(session);
    }

    private void advance(OnboardingSession session) {
        List<StageRecord> stages = registry.stages(session.getId());
        int next = session.getCurrentStageIndex() + 1;

        if (next >= stages.size()) {
            session.setState(SessionState.FINALIZING);
            session.setCurrentStageIndex(stages.size());
            session.setOverallProgress(100.0);
            session.touch(clock.instant());
            session = registry.saveSession(session);
            log.info("Session {} finalizing", session.getId());
            terminate(session, SessionState.COMPLETED, "all stages completed");
            return;
        }

        session.setCurrentStageIndex(next);
        updateProgress(session);
        session.touch(clock.instant());
        session = registry.saveSession(session);

        StageRecord nextRecord = stages.get(next);
        if (session.getState() == SessionState.RUNNING) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("stage", nextRecord.getStage().name())) {
                dispatchStage(session, nextRecord);
            }
        } else {
            log.info("Session {} is {}; {} will be dispatched on resume",
                    session.getId(), session.getState(), nextRecord.getStage());
        }
    }

    private void dispatchStage(OnboardingSession session, StageRecord record) {
        slaStore.remove(session.getId(), record.getStage());
        record.transitionTo(StageStatus.PROCESSING, clock.instant());
        record = registry.saveStage(record);
        metrics.stageTransition(record.getStage(), StageStatus.PROCESSING);

        try {
            dispatcher.dispatch(session.getId(), record.getStage(), record.getRetryCount() + 1);
            log.info("{} dispatched", record.getStage());
        } catch (DependencyUnavailableException e) {
            dispatchFailed(session, record, FailureKind.DEPENDENCY_UNAVAILABLE, "DEPENDENCY_UNAVAILABLE", e.getMessage());
        } catch (CollaboratorException e) {
            dispatchFailed(session, record, FailureKind.TRANSIENT, "DISPATCH_FAILED", e.getMessage());
        }
    }

    private void dispatchFailed(OnboardingSession session, StageRecord record,
                                FailureKind kind, String code, String message) {
        record.transitionTo(StageStatus.FAILED, clock.instant());
        record.recordErrors(List.of(new StageError(code, message)));
        record = registry.saveStage(record);
        metrics.stageTransition(record.getStage(), StageStatus.FAILED);
        log.warn("Dispatch of {} failed: {}", record.getStage(), message);
        startRecovery(session, record, kind, record.getErrorCount(), message, StageDispatcher.SERVICE);
    }

    private void updateProgress(OnboardingSession session) {
        List<StageRecord> stages = registry.stages(session.getId());
        if (stages.isEmpty()) return;
        long completed = stages.stream().filter(s -> s.getStatus() == StageStatus.COMPLETED).count();
        double current = currentRecord(session)
                .filter(r -> r.getStatus() != StageStatus.COMPLETED)
                .map(StageRecord::getProgressPercent)
                .orElse(0.0);
        double progress = (completed * 100.0 + current) / stages.size();
        session.setOverallProgress(Math.round(progress * 100.0) / 100.0);
    }

    // ------------------------------------------------------------------
    // Escalation / recovery
    // ------------------------------------------------------------------

    private void runEscalation(OnboardingSession session, Instant now) {
        EscalationOutcome outcome = escalations.evaluate(signals(session, now), now);
        if (outcome.pauseRequested() && session.getState() == SessionState.RUNNING) {
            String rules = outcome.events().stream().map(EscalationEvent::getRuleId).collect(Collectors.joining(", "));
            pauseInternal(session, "paused by escalation: " + rules);
        }
    }

    private EscalationSignals signals(OnboardingSession session, Instant now) {
        ResilienceConfiguration cfg = config.current();
        UUID id = session.getId();
        Map<PipelineStage, GateStatus> latestGate = new LinkedHashMap<>();
        for (QualityGateRecord g : registry.gateResults(id)) {
            latestGate.put(g.getStage(), g.getStatus());
        }

        List<StageSignal> stageSignals = new ArrayList<>();
        for (StageRecord r : registry.stages(id)) {
            stageSignals.add(new StageSignal(
                    r.getStage(),
                    r.getStatus(),
                    cfg.sla(r.getStage()).criticality(),
                    r.getErrorCount(),
                    r.getRetryCount(),
                    latestGate.get(r.getStage()),
                    currentAttemptSla(id, r)));
        }
        return new EscalationSignals(id, session.getSubjectId(), stageSignals, circuits.snapshots(),
                !slaMonitor.isWithinBusinessHours(now));
    }

    /**
     * The stored SLA result for a stage's current attempt. Results of completed
     * stages, and results taken before a reset and re-dispatch, are left out.
     */
    private SlaResult currentAttemptSla(UUID sessionId, StageRecord record) {
        if (record.getStatus() == StageStatus.COMPLETED || record.getStartedAt() == null) return null;
        return slaStore.latest(sessionId, record.getStage())
                .filter(sla -> !sla.evaluatedAt().isBefore(record.getStartedAt()))
                .orElse(null);
    }

    private void escalateDirect(OnboardingSession session, PipelineStage stage,
                                EscalationLevel level, String reason, boolean requiresAck) {
        escalations.escalateDirect(new DirectEscalation(session.getId(), session.getSubjectId(), stage,
                EscalationType.QUALITY_FAILURE, level, reason, requiresAck));
    }

    private void startRecovery(OnboardingSession session, StageRecord record, FailureKind kind,
                               int errorCount, String message, String dependency) {
        UUID id = session.getId();
        FailureContext ctx = new FailureContext(id, record.getStage(), kind, errorCount,
                record.getRetryCount(), message, dependency);
        CompletableFuture<RecoveryResult> future = recovery.recover(ctx)
                .thenApply(result -> {
                    applyRecoveryResult(result);
                    return result;
                });
        recoveries.put(id, future);
    }

    private void applyRecoveryResult(RecoveryResult result) {
        UUID id = result.sessionId();
        inLock(id, result.stage(), () -> {
            OnboardingSession session = registry.findSession(id).orElse(null);
            if (session == null || session.isTerminal() || result.cancelled()) {
                return null;
            }
            switch (result.status()) {
                case SUCCESS -> log.info("Recovery of {} succeeded ({})", result.stage(), result.strategy());
                case PARTIAL -> {
                    session.markDegraded();
                    session.touch(clock.instant());
                    registry.saveSession(session);
                    log.warn("Session {} degraded after partial recovery of {}: {}",
                            id, result.stage(), result.message());
                }
                case FAILED -> terminate(session, SessionState.FAILED_REQUIRES_RECOVERY, result.message());
            }
            return null;
        });
    }

    // ------------------------------------------------------------------
    // Pause / termination
    // ------------------------------------------------------------------

    private OnboardingSession pauseInternal(OnboardingSession session, String reason) {
        session.setState(SessionState.PAUSED);
        session.touch(clock.instant());
        session = registry.saveSession(session);
        retryScheduler.cancelSession(session.getId());
        log.warn("Session {} paused: {}", session.getId(), reason);
        return session;
    }

    private OnboardingSession terminate(OnboardingSession session, SessionState state, String reason) {
        Instant now = clock.instant();
        UUID id = session.getId();
        session.setState(state);
        session.setTerminalReason(reason);
        session.setCompletedAt(now);
        session.touch(now);
        session.setResultJson(terminalResult(session));
        session = registry.saveSession(session);

        retryScheduler.cancelSession(id);
        slaStore.remove(id);
        escalations.forgetSession(id);
        recoveries.remove(id);
        metrics.sessionTerminated(state);

        if (state == SessionState.FAILED_REQUIRES_RECOVERY) {
            log.error("Session {} FAILED_REQUIRES_RECOVERY: {}", id, reason);
        } else {
            log.info("Session {} {}: {}", id, state, reason);
        }
        return session;
    }

    private String terminalResult(OnboardingSession session) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("session_id", session.getId().toString());
        result.put("subject_id", session.getSubjectId());
        result.put("state",      session.getState().name());
        result.put("reason",     session.getTerminalReason());
        result.put("degraded",   session.isDegraded());

        List<Map<String, Object>> stages = new ArrayList<>();
        for (StageRecord r : registry.stages(session.getId())) {
            Map<String, Object> stage = new LinkedHashMap<>();
            stage.put("stage",       r.getStage().name());
            stage.put("status",      r.getStatus().name());
            stage.put("retry_count", r.getRetryCount());
            stage.put("error_count", r.getErrorCount());
            stage.put("errors",      r.getErrors());
            stages.add(stage);
        }
        result.put("stages", stages);
        return write(result);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Run {@code action} in the session lock with MDC set. A session that
     * ended during the action gives up its lock afterwards.
     */
    private <T> T inLock(UUID sessionId, PipelineStage stage, Supplier<T> action) {
        try {
            return locks.call(sessionId, () -> {
                try (MDC.MDCCloseable s = MDC.putCloseable("sessionId", sessionId.toString());
                     MDC.MDCCloseable st = MDC.putCloseable("stage", stage == null ? "-" : stage.name())) {
                    return action.get();
                }
            });
        } finally {
            if (!locks.isHeldByCurrentThread(sessionId)
                    && registry.findSession(sessionId).map(OnboardingSession::isTerminal).orElse(false)) {
                locks.release(sessionId);
            }
        }
    }

    private OnboardingSession requireSession(UUID sessionId) {
        return registry.findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private OnboardingSession requireOpenSession(UUID sessionId) {
        OnboardingSession session = requireSession(sessionId);
        if (session.isTerminal()) {
            throw new SessionClosedException(sessionId, session.getState());
        }
        return session;
    }

    private StageRecord requireStage(UUID sessionId, PipelineStage stage) {
        return registry.stage(sessionId, stage).orElseThrow(() ->
                new IllegalStageTransitionException("Session " + sessionId + " has no stage " + stage));
    }

    private Optional<StageRecord> currentRecord(OnboardingSession session) {
        List<StageRecord> stages = registry.stages(session.getId());
        int index = session.getCurrentStageIndex();
        return index < stages.size() ? Optional.of(stages.get(index)) : Optional.empty();
    }

    private static boolean isCurrent(OnboardingSession session, StageRecord record) {
        return record.getPosition() == session.getCurrentStageIndex();
    }

    private static void requireCurrentAndProcessing(OnboardingSession session, StageRecord record) {
        if (!isCurrent(session, record)) {
            throw new IllegalStageTransitionException(record.getStage() + " is not the current stage");
        }
        if (record.getStatus() != StageStatus.PROCESSING) {
            throw new IllegalStageTransitionException(
                    record.getStage() + " is " + record.getStatus() + ", not PROCESSING");
        }
    }

    private Optional<QualityGateRecord> latestGateResult(UUID sessionId, PipelineStage stage) {
        QualityGateRecord latest = null;
        for (QualityGateRecord g : registry.gateResults(sessionId)) {
            if (g.getStage() == stage) latest = g;
        }
        return Optional.ofNullable(latest);
    }

    private List<StageError> parseErrors(StageRecord record) {
        List<StageError> errors = new ArrayList<>();
        for (String entry : record.getErrors()) {
            int colon = entry.indexOf(':');
            errors.add(colon < 0
                    ? new StageError(entry, "")
                    : new StageError(entry.substring(0, colon), entry.substring(colon + 1).trim()));
        }
        return errors;
    }

    /** Built from freshly read state; the instances a caller holds may be stale after a save. */
    private OutcomeReceipt receipt(OnboardingSession session, StageRecord record,
                                   boolean duplicate, GateStatus gateStatus) {
        UUID id = session.getId();
        return new OutcomeReceipt(id, record.getStage(), duplicate,
                requireStage(id, record.getStage()).getStatus(), gateStatus, requireSession(id).getState());
    }

    /** MD5 over the payload with object keys sorted at every level, so key order never matters. */
    private String payloadHash(JsonNode payload) {
        if (payload == null) {
            return DigestUtils.md5DigestAsHex("null".getBytes(StandardCharsets.UTF_8));
        }
        String canonical;
        try {
            canonical = canonicalJson.writeValueAsString(json.convertValue(payload, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize payload", e);
        }
        return DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
    }

    private String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private JsonNode read(String payload) {
        if (payload == null) return null;
        try {
            return json.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not valid JSON", e);
        }
    }
}
