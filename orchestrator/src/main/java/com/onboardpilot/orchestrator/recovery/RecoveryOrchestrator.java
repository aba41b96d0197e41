package com.onboardpilot.orchestrator.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onboardpilot.orchestrator.circuit.CircuitBreakerManager;
import com.onboardpilot.orchestrator.circuit.CircuitSnapshot;
import com.onboardpilot.orchestrator.circuit.CircuitState;
import com.onboardpilot.orchestrator.circuit.DependencyUnavailableException;
import com.onboardpilot.orchestrator.circuit.HealthProbe;
import com.onboardpilot.orchestrator.collaborator.CollaboratorException;
import com.onboardpilot.orchestrator.collaborator.StageDispatcher;
import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.escalation.DirectEscalation;
import com.onboardpilot.orchestrator.escalation.EscalationRuleEngine;
import com.onboardpilot.orchestrator.escalation.EscalationType;
import com.onboardpilot.orchestrator.metrics.PipelineMetrics;
import com.onboardpilot.orchestrator.model.AttemptStatus;
import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.RecoveryAction;
import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import com.onboardpilot.orchestrator.model.RecoveryStrategy;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.model.StageError;
import com.onboardpilot.orchestrator.model.StageRecord;
import com.onboardpilot.orchestrator.model.StageStatus;
import com.onboardpilot.orchestrator.registry.SessionLocks;
import com.onboardpilot.orchestrator.registry.StageRegistry;
import com.onboardpilot.orchestrator.sla.SlaSnapshotStore;
import com.onboardpilot.orchestrator.sla.StageCriticality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Picks and runs a recovery strategy for a failed stage.
 *
 * Strategy selection, first match wins:
 * <ol>
 *   <li>IMMEDIATE_RETRY: transient or quality failures below the immediate-retry error limit</li>
 *   <li>EXPONENTIAL_BACKOFF_RETRY: resource exhaustion, unavailable dependencies, transient over the limit</li>
 *   <li>STATE_RESTORATION: inconsistent state</li>
 *   <li>WORKFLOW_RESUMPTION: anything recoverable while resumptions remain</li>
 *   <li>ESCALATE_TO_HUMAN: everything else, and any stage whose retry budget is spent</li>
 * </ol>
 *
 * All work runs on {@link RetryScheduler} timers and inside the session lock.
 * The returned future completes with the true outcome: SUCCESS, PARTIAL or
 * FAILED. It is never upgraded to SUCCESS. Cancelling the session completes
 * it as FAILED with {@code cancelled=true}.
 */
@Component
public class RecoveryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryOrchestrator.class);

    // Upper bound on waits for a circuit that keeps rejecting calls within one attempt.
    static final int MAX_CIRCUIT_WAITS = 20;

    private final StageRegistry         registry;
    private final SlaSnapshotStore      slaStore;
    private final SessionLocks          locks;
    private final StageDispatcher       dispatcher;
    private final CircuitBreakerManager circuits;
    private final HealthProbe           probe;
    private final EscalationRuleEngine  escalations;
    private final RetryScheduler        scheduler;
    private final ConfigurationRegistry config;
    private final PipelineMetrics       metrics;
    private final ObjectMapper          json;
    private final java.time.Clock       clock;

    public RecoveryOrchestrator(StageRegistry registry,
                                SlaSnapshotStore slaStore,
                                SessionLocks locks,
                                StageDispatcher dispatcher,
                                CircuitBreakerManager circuits,
                                HealthProbe probe,
                                EscalationRuleEngine escalations,
                                RetryScheduler scheduler,
                                ConfigurationRegistry config,
                                PipelineMetrics metrics,
                                ObjectMapper objectMapper,
                                java.time.Clock clock) {
        this.registry    = registry;
        this.slaStore    = slaStore;
        this.locks       = locks;
        this.dispatcher  = dispatcher;
        this.circuits    = circuits;
        this.probe       = probe;
        this.escalations = escalations;
        this.scheduler   = scheduler;
        this.config      = config;
        this.metrics     = metrics;
        this.json        = objectMapper;
        this.clock       = clock;
    }

    // ------------------------------------------------------------------
    // Strategy selection
    // ------------------------------------------------------------------

    public static RecoveryStrategy selectStrategy(FailureContext ctx, int workflowResumptions, RecoveryConfig cfg) {
        if (ctx.priorAttempts() >= cfg.maxRetryAttempts()) {
            return RecoveryStrategy.ESCALATE_TO_HUMAN;
        }
        FailureKind kind = ctx.kind();
        boolean belowLimit = ctx.errorCount() < cfg.immediateRetryErrorLimit();

        if ((kind == FailureKind.TRANSIENT || kind == FailureKind.QUALITY_VIOLATION) && belowLimit) {
            return RecoveryStrategy.IMMEDIATE_RETRY;
        }
        if (kind == FailureKind.RESOURCE_EXHAUSTION
                || kind == FailureKind.DEPENDENCY_UNAVAILABLE
                || kind == FailureKind.TRANSIENT) {
            return RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY;
        }
        if (kind == FailureKind.STATE_INCONSISTENCY) {
            return RecoveryStrategy.STATE_RESTORATION;
        }
        if (kind != FailureKind.UNRECOVERABLE && workflowResumptions < cfg.maxWorkflowResumptions()) {
            return RecoveryStrategy.WORKFLOW_RESUMPTION;
        }
        return RecoveryStrategy.ESCALATE_TO_HUMAN;
    }

    // ------------------------------------------------------------------
    // Automatic recovery
    // ------------------------------------------------------------------

    /**
     * Start recovering {@code ctx}. Returns immediately; the work happens on
     * recovery timers.
     */
    public CompletableFuture<RecoveryResult> recover(FailureContext ctx) {
        RecoveryConfig cfg = config.current().recovery();
        int resumptions = registry.findSession(ctx.sessionId())
                .map(OnboardingSession::getWorkflowResumptions)
                .orElse(0);
        Run run = new Run(ctx, selectStrategy(ctx, resumptions, cfg), cfg, clock.instant());

        log.info("Recovering {} of session {} from {} ({} prior attempts): strategy {}",
                ctx.stage(), ctx.sessionId(), ctx.kind(), ctx.priorAttempts(), run.strategy);

        UUID id = ctx.sessionId();
        CompletableFuture<RecoveryResult> chain = switch (run.strategy) {
            case IMMEDIATE_RETRY, EXPONENTIAL_BACKOFF_RETRY -> retry(run, 1, 0);
            case STATE_RESTORATION -> scheduler.delay(id, Duration.ZERO)
                    .thenApply(v -> inSession(run, session -> restoreState(run, session),
                            reason -> cancelled(run, reason)));
            case WORKFLOW_RESUMPTION -> scheduler.delay(id, Duration.ZERO)
                    .thenApply(v -> inSession(run, session -> resumeWorkflow(run, session),
                            reason -> cancelled(run, reason)));
            case ESCALATE_TO_HUMAN -> scheduler.delay(id, Duration.ZERO)
                    .thenApply(v -> inSession(run, session -> escalate(run, session, escalationReason(run)),
                            reason -> cancelled(run, reason)));
        };
        return chain.handle((result, error) -> finish(run, result, error));
    }

    // ------------------------------------------------------------------
    // Operator retry
    // ------------------------------------------------------------------

    /**
     * Explicit reset and re-dispatch of one stage on an operator's request.
     * Runs synchronously; the caller must hold the session lock.
     */
    public RecoveryResult retryNow(OnboardingSession session, StageRecord record, String operator) {
        FailureContext ctx = new FailureContext(session.getId(), record.getStage(), FailureKind.TRANSIENT,
                record.getErrorCount(), record.getRetryCount(), "operator retry by " + operator, null);
        Run run = new Run(ctx, RecoveryStrategy.IMMEDIATE_RETRY, config.current().recovery(), clock.instant());

        log.info("Operator '{}' retries {} of session {}", operator, record.getStage(), session.getId());
        boolean dispatched = dispatchFresh(run, record, RecoveryAction.RETRY, true);
        RecoveryResult result = dispatched
                ? result(run, RecoveryStatus.SUCCESS, false, "stage re-dispatched by " + operator)
                : result(run, RecoveryStatus.FAILED, false, "re-dispatch failed; stage is FAILED again");
        metrics.recoveryFinished(run.strategy, result.status().name(), Duration.between(run.startedAt, clock.instant()));
        return result;
    }

    // ------------------------------------------------------------------
    // Retry
    // ------------------------------------------------------------------

    private enum StepKind { DISPATCHED, FAILED, REJECTED, INACTIVE }

    private record Step(StepKind kind, String message) {}

    private CompletableFuture<RecoveryResult> retry(Run run, int attempt, int circuitWaits) {
        Duration delay = BackoffPolicy.delay(run.strategy, attempt, run.cfg);
        if (circuitWaits > 0) {
            Duration recoveryTimeout = config.current().circuitBreaker().recoveryTimeout();
            delay = delay.compareTo(recoveryTimeout) > 0 ? delay : recoveryTimeout;
        }
        log.debug("Retry {} of {} for session {} in {} ms", attempt, run.ctx.stage(), run.ctx.sessionId(),
                delay.toMillis());

        return scheduler.delay(run.ctx.sessionId(), delay)
                .thenApply(v -> inSession(run, session -> redispatch(run, attempt),
                        reason -> new Step(StepKind.INACTIVE, reason)))
                .thenCompose(step -> switch (step.kind()) {
                    case DISPATCHED -> CompletableFuture.completedFuture(
                            result(run, RecoveryStatus.SUCCESS, false, step.message()));
                    case INACTIVE -> CompletableFuture.completedFuture(cancelled(run, step.message()));
                    case REJECTED -> circuitWaits + 1 < MAX_CIRCUIT_WAITS
                            ? retry(run, attempt, circuitWaits + 1)
                            : afterFailedAttempt(run, attempt, "dependency stayed unavailable: " + step.message());
                    case FAILED -> afterFailedAttempt(run, attempt, step.message());
                });
    }

    private CompletableFuture<RecoveryResult> afterFailedAttempt(Run run, int attempt, String message) {
        if (attempt < run.budget) {
            return retry(run, attempt + 1, 0);
        }
        String reason = "retry budget exhausted after " + (run.ctx.priorAttempts() + attempt)
                + " attempts; last error: " + message;
        return CompletableFuture.completedFuture(inSession(run,
                session -> escalate(run, session, reason),
                inactive -> cancelled(run, inactive)));
    }

    /** One retry attempt. Runs under the session lock. */
    private Step redispatch(Run run, int attempt) {
        StageRecord record = stageRecord(run);
        if (record.getStatus() == StageStatus.PROCESSING || record.getStatus() == StageStatus.COMPLETED) {
            return new Step(StepKind.INACTIVE, "stage is already " + record.getStatus());
        }
        Instant now = clock.instant();
        if (circuits.evaluate(StageDispatcher.SERVICE, now).state() == CircuitState.OPEN) {
            log.info("Retry {} of {} deferred: circuit '{}' is open", attempt, record.getStage(),
                    StageDispatcher.SERVICE);
            return new Step(StepKind.REJECTED, "circuit '" + StageDispatcher.SERVICE + "' is open");
        }
        try {
            return dispatchFresh(run, record, RecoveryAction.RETRY, false)
                    ? new Step(StepKind.DISPATCHED, "stage re-dispatched on attempt " + attempt)
                    : new Step(StepKind.FAILED, "re-dispatch failed on attempt " + attempt);
        } catch (DependencyUnavailableException e) {
            return new Step(StepKind.REJECTED, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // State restoration / workflow resumption
    // ------------------------------------------------------------------

    private RecoveryResult restoreState(Run run, OnboardingSession session) {
        StageRecord failing = stageRecord(run);
        Instant started = clock.instant();

        List<String> restored   = new ArrayList<>();
        List<String> unverified = new ArrayList<>();
        for (StageRecord done : registry.stages(session.getId())) {
            if (done.getStatus() != StageStatus.COMPLETED || done.getPosition() >= failing.getPosition()) continue;
            if (done.getCheckpointPayload() == null) {
                unverified.add(done.getStage().name());
            } else if (!Objects.equals(done.getCheckpointPayload(), done.getOutputPayload())) {
                done.setOutputPayload(done.getCheckpointPayload());
                registry.saveStage(done);
                restored.add(done.getStage().name());
            }
        }
        if (failing.getStatus() != StageStatus.WAITING) {
            failing = resetStage(failing);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reset_stage", failing.getStage().name());
        payload.put("restored",    restored);
        payload.put("unverified",  unverified);
        recordAttempt(run, RecoveryAction.STATE_RESTORE, AttemptStatus.SUCCEEDED, started, toJson(payload), null);
        if (!restored.isEmpty()) {
            log.warn("Restored checkpointed output of {} for session {}", restored, session.getId());
        }

        if (!dispatchFresh(run, failing, RecoveryAction.RETRY, true)) {
            return escalate(run, session, "state restored but re-dispatch of " + failing.getStage() + " failed");
        }
        return unverified.isEmpty()
                ? result(run, RecoveryStatus.SUCCESS, false, "state restored, stage re-dispatched")
                : result(run, RecoveryStatus.PARTIAL, false, "stage re-dispatched; no checkpoint to verify " + unverified);
    }

    private RecoveryResult resumeWorkflow(Run run, OnboardingSession session) {
        List<StageRecord> stages = registry.stages(session.getId());
        int resumeIndex = 0;
        while (resumeIndex < stages.size() && stages.get(resumeIndex).getStatus() == StageStatus.COMPLETED) {
            resumeIndex++;
        }
        if (resumeIndex == stages.size()) {
            return cancelled(run, "every stage is already completed; nothing to resume");
        }

        for (int i = resumeIndex; i < stages.size(); i++) {
            StageRecord later = stages.get(i);
            if (later.getStatus() != StageStatus.WAITING) {
                stages.set(i, resetStage(later));
            }
        }

        boolean resetFailed = false;
        for (CircuitSnapshot circuit : circuits.snapshots()) {
            if (circuit.state() == CircuitState.CLOSED) continue;
            Instant started = clock.instant();
            String service = circuit.serviceName();
            if (probe.isHealthy(service)) {
                circuits.reset(service);
                recordAttempt(run, RecoveryAction.CIRCUIT_RESET, AttemptStatus.SUCCEEDED, started,
                        toJson(Map.of("service", service, "previous_state", circuit.state().name())), null);
            } else {
                resetFailed = true;
                recordAttempt(run, RecoveryAction.CIRCUIT_RESET, AttemptStatus.FAILED, started,
                        toJson(Map.of("service", service, "previous_state", circuit.state().name())),
                        "'" + service + "' is still unhealthy");
            }
        }

        session.setCurrentStageIndex(resumeIndex);
        session.incrementWorkflowResumptions();
        session.touch(clock.instant());
        registry.saveSession(session);

        StageRecord next = stages.get(resumeIndex);
        log.info("Resuming session {} from {} (resumption {})", session.getId(), next.getStage(),
                session.getWorkflowResumptions());
        if (!dispatchFresh(run, next, RecoveryAction.WORKFLOW_RESUME, true)) {
            return escalate(run, session, "workflow resumption could not dispatch " + next.getStage());
        }
        return resetFailed
                ? result(run, RecoveryStatus.PARTIAL, false, "resumed from " + next.getStage()
                        + " with dependencies still unhealthy")
                : result(run, RecoveryStatus.SUCCESS, false, "resumed from " + next.getStage());
    }

    // ------------------------------------------------------------------
    // Escalation
    // ------------------------------------------------------------------

    private RecoveryResult escalate(Run run, OnboardingSession session, String reason) {
        Instant started = clock.instant();
        StageCriticality criticality = config.current().sla(run.ctx.stage()).criticality();
        EscalationLevel level = criticality == StageCriticality.HIGH ? EscalationLevel.EMERGENCY : EscalationLevel.CRITICAL;

        EscalationEvent event = escalations.escalateDirect(new DirectEscalation(
                session.getId(), session.getSubjectId(), run.ctx.stage(),
                EscalationType.STAGE_FAILURE, level, reason, true));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("escalation_id", event.getId().toString());
        payload.put("level",         level.name());
        payload.put("failure_kind",  run.ctx.kind().name());
        recordAttempt(run, RecoveryAction.ESCALATE, AttemptStatus.SUCCEEDED, started, toJson(payload), reason);

        log.error("Automatic recovery of {} for session {} gave up: {}", run.ctx.stage(), session.getId(), reason);
        return result(run, RecoveryStatus.FAILED, true, reason);
    }

    private static String escalationReason(Run run) {
        if (run.ctx.priorAttempts() >= run.cfg.maxRetryAttempts()) {
            return "retry budget of " + run.cfg.maxRetryAttempts() + " attempts already spent"
                    + (run.ctx.message() == null ? "" : "; last error: " + run.ctx.message());
        }
        return run.ctx.kind() + " failure cannot be recovered automatically"
                + (run.ctx.message() == null ? "" : ": " + run.ctx.message());
    }

    // ------------------------------------------------------------------
    // Shared steps
    // ------------------------------------------------------------------

    /** Back to WAITING; the SLA result of the abandoned attempt goes with it. */
    private StageRecord resetStage(StageRecord record) {
        slaStore.remove(record.getSessionId(), record.getStage());
        return registry.resetStage(record);
    }

    /**
     * Reset (if needed) and dispatch a stage, recording the attempt.
     *
     * @param swallowRejection when false a {@link DependencyUnavailableException}
     *                         propagates without an attempt being recorded
     * @return true if the worker accepted the dispatch
     */
    private boolean dispatchFresh(Run run, StageRecord record, RecoveryAction action, boolean swallowRejection) {
        Instant started = clock.instant();
        if (record.getStatus() != StageStatus.WAITING) {
            record = resetStage(record);
        }
        record.transitionTo(StageStatus.PROCESSING, started);
        record = registry.saveStage(record);
        metrics.stageTransition(record.getStage(), StageStatus.PROCESSING);

        int dispatchAttempt = record.getRetryCount() + 2;
        try {
            dispatcher.dispatch(run.ctx.sessionId(), record.getStage(), dispatchAttempt);
            record.incrementRetryCount();
            registry.saveStage(record);
            recordAttempt(run, action, AttemptStatus.SUCCEEDED, started,
                    toJson(Map.of("stage", record.getStage().name(), "dispatch_attempt", dispatchAttempt)), null);
            return true;
        } catch (DependencyUnavailableException e) {
            markDispatchFailed(record, "DEPENDENCY_UNAVAILABLE", e.getMessage());
            if (!swallowRejection) throw e;
            recordAttempt(run, action, AttemptStatus.FAILED, started, null, e.getMessage());
            return false;
        } catch (CollaboratorException e) {
            record.incrementRetryCount();
            markDispatchFailed(record, "DISPATCH_FAILED", e.getMessage());
            recordAttempt(run, action, AttemptStatus.FAILED, started, null, e.getMessage());
            return false;
        }
    }

    private void markDispatchFailed(StageRecord record, String code, String message) {
        record.transitionTo(StageStatus.FAILED, clock.instant());
        record.recordErrors(List.of(new StageError(code, message)));
        registry.saveStage(record);
        metrics.stageTransition(record.getStage(), StageStatus.FAILED);
        log.warn("Dispatch of {} failed: {}", record.getStage(), message);
    }

    private void recordAttempt(Run run, RecoveryAction action, AttemptStatus status,
                               Instant startedAt, String payload, String error) {
        long previous = registry.attempts(run.ctx.sessionId()).stream()
                .filter(a -> a.getStage() == run.ctx.stage())
                .count();
        RecoveryAttempt attempt = registry.saveAttempt(new RecoveryAttempt(
                run.ctx.sessionId(), run.ctx.stage(), run.strategy, action, (int) previous + 1,
                status, startedAt, clock.instant(), payload, error));
        run.attempts.add(attempt);
        metrics.recoveryAttempt(action, status);
    }

    /**
     * Run {@code action} under the session lock if the session is still
     * RUNNING; otherwise answer with {@code inactive}.
     */
    private <T> T inSession(Run run, Function<OnboardingSession, T> action, Function<String, T> inactive) {
        UUID id = run.ctx.sessionId();
        return locks.call(id, () -> withMdc(run, () -> {
            OnboardingSession session = registry.findSession(id).orElse(null);
            if (session == null) {
                return inactive.apply("session no longer exists");
            }
            if (session.getState() != SessionState.RUNNING) {
                return inactive.apply("session is " + session.getState());
            }
            return action.apply(session);
        }));
    }

    private StageRecord stageRecord(Run run) {
        return registry.stage(run.ctx.sessionId(), run.ctx.stage())
                .orElseThrow(() -> new IllegalStateException(
                        "Session " + run.ctx.sessionId() + " has no stage " + run.ctx.stage()));
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    private RecoveryResult finish(Run run, RecoveryResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CancellationException) {
                result = locks.call(run.ctx.sessionId(), () -> {
                    recordAttempt(run, pendingAction(run), AttemptStatus.CANCELLED, clock.instant(), null,
                            "cancelled with the session");
                    return cancelled(run, "recovery cancelled with the session");
                });
            } else {
                log.error("Recovery of {} for session {} failed unexpectedly", run.ctx.stage(),
                        run.ctx.sessionId(), cause);
                result = inSession(run,
                        session -> escalate(run, session, "recovery aborted: " + cause.getMessage()),
                        inactive -> result(run, RecoveryStatus.FAILED, false,
                                "recovery aborted: " + cause.getMessage()));
            }
        }

        Duration took = Duration.between(run.startedAt, clock.instant());
        metrics.recoveryFinished(run.strategy, result.cancelled() ? "CANCELLED" : result.status().name(), took);
        log.info("Recovery of {} for session {} finished: {}{} after {} attempt(s) ({})",
                run.ctx.stage(), run.ctx.sessionId(), result.status(),
                result.cancelled() ? " (cancelled)" : "", result.attempts().size(), result.message());
        return result;
    }

    private static RecoveryAction pendingAction(Run run) {
        return switch (run.strategy) {
            case STATE_RESTORATION   -> RecoveryAction.STATE_RESTORE;
            case WORKFLOW_RESUMPTION -> RecoveryAction.WORKFLOW_RESUME;
            case ESCALATE_TO_HUMAN   -> RecoveryAction.ESCALATE;
            default                  -> RecoveryAction.RETRY;
        };
    }

    private static RecoveryResult result(Run run, RecoveryStatus status, boolean escalationRequired, String message) {
        return new RecoveryResult(run.ctx.sessionId(), run.ctx.stage(), run.strategy, status,
                false, escalationRequired, run.attempts, message);
    }

    private static RecoveryResult cancelled(Run run, String message) {
        return new RecoveryResult(run.ctx.sessionId(), run.ctx.stage(), run.strategy, RecoveryStatus.FAILED,
                true, false, run.attempts, message);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T withMdc(Run run, Supplier<T> action) {
        try (MDC.MDCCloseable s = MDC.putCloseable("sessionId", run.ctx.sessionId().toString());
             MDC.MDCCloseable st = MDC.putCloseable("stage", run.ctx.stage().name())) {
            return action.get();
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize recovery payload", e);
        }
    }

    /** State of one recovery from start to finish. */
    private static final class Run {
        final FailureContext        ctx;
        final RecoveryStrategy      strategy;
        final RecoveryConfig        cfg;
        final Instant               startedAt;
        final int                   budget;
        final List<RecoveryAttempt> attempts = new CopyOnWriteArrayList<>();

        Run(FailureContext ctx, RecoveryStrategy strategy, RecoveryConfig cfg, Instant startedAt) {
            this.ctx       = ctx;
            this.strategy  = strategy;
            this.cfg       = cfg;
            this.startedAt = startedAt;
            this.budget    = Math.max(1, cfg.maxRetryAttempts() - ctx.priorAttempts());
        }
    }
}
