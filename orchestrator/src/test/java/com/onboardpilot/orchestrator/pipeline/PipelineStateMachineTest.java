package com.onboardpilot.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.onboardpilot.orchestrator.MutableClock;
import com.onboardpilot.orchestrator.TestConfigs;
import com.onboardpilot.orchestrator.circuit.CircuitBreakerManager;
import com.onboardpilot.orchestrator.circuit.HealthProbe;
import com.onboardpilot.orchestrator.collaborator.CollaboratorException;
import com.onboardpilot.orchestrator.collaborator.OperationsGateway;
import com.onboardpilot.orchestrator.collaborator.StageDispatcher;
import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.config.ResilienceConfiguration;
import com.onboardpilot.orchestrator.escalation.AutomaticActionExecutor;
import com.onboardpilot.orchestrator.escalation.CooldownTracker;
import com.onboardpilot.orchestrator.escalation.EscalationRuleEngine;
import com.onboardpilot.orchestrator.gate.BypassRequest;
import com.onboardpilot.orchestrator.gate.FailureAction;
import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.gate.QualityGateEngine;
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
import com.onboardpilot.orchestrator.recovery.RecoveryOrchestrator;
import com.onboardpilot.orchestrator.recovery.RecoveryResult;
import com.onboardpilot.orchestrator.recovery.RetryScheduler;
import com.onboardpilot.orchestrator.registry.InMemoryStageRegistry;
import com.onboardpilot.orchestrator.registry.SessionLocks;
import com.onboardpilot.orchestrator.sla.SlaMonitor;
import com.onboardpilot.orchestrator.sla.SlaResult;
import com.onboardpilot.orchestrator.sla.SlaSnapshotStore;
import com.onboardpilot.orchestrator.sla.SlaStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Wires the real engines around an in-memory registry. Only the worker and
 * operations gateways are mocked.
 */
@ExtendWith(MockitoExtension.class)
class PipelineStateMachineTest {

    private static final Instant MONDAY_10AM = Instant.parse("2026-03-02T10:00:00Z");

    @Mock StageDispatcher   dispatcher;
    @Mock OperationsGateway operations;
    @Mock HealthProbe       probe;

    final ObjectMapper json = new ObjectMapper();

    ScheduledExecutorService timers;
    MutableClock             clock;
    InMemoryStageRegistry    registry;
    PipelineStateMachine     machine;

    @BeforeEach
    void setUp() {
        timers = Executors.newSingleThreadScheduledExecutor();
        lenient().when(operations.notify(any())).thenReturn(Optional.of("notif-1"));
        lenient().when(operations.createIncident(any())).thenReturn(Optional.of("INC-1"));
        build(TestConfigs.config());
    }

    @AfterEach
    void tearDown() {
        timers.shutdownNow();
    }

    private void build(ResilienceConfiguration configuration) {
        ConfigurationRegistry config  = TestConfigs.registry(configuration);
        PipelineMetrics       metrics = new PipelineMetrics(new SimpleMeterRegistry());
        SessionLocks          locks   = new SessionLocks();
        clock    = new MutableClock(MONDAY_10AM);
        registry = new InMemoryStageRegistry();
        SlaSnapshotStore slaStore = new SlaSnapshotStore();

        CircuitBreakerManager circuits = new CircuitBreakerManager(config, metrics, clock);
        EscalationRuleEngine escalations = new EscalationRuleEngine(config, new CooldownTracker(), operations,
                new AutomaticActionExecutor(operations, config), registry, metrics, clock);
        RetryScheduler scheduler = new RetryScheduler(timers);
        RecoveryOrchestrator recovery = new RecoveryOrchestrator(registry, slaStore, locks, dispatcher, circuits,
                probe, escalations, scheduler, config, metrics, json, clock);

        machine = new PipelineStateMachine(registry, locks, config,
                new QualityGateEngine(config, metrics, clock),
                new SlaMonitor(config, metrics), slaStore,
                circuits, escalations, recovery, scheduler, new ErrorClassifier(),
                dispatcher, metrics, json, clock);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void startSession_dispatchesFirstStage() {
        OnboardingSession session = machine.startSession("emp-42");

        assertThat(session.getState()).isEqualTo(SessionState.RUNNING);
        assertThat(stage(session, PipelineStage.DATA_AGGREGATION).getStatus()).isEqualTo(StageStatus.PROCESSING);
        assertThat(stage(session, PipelineStage.IT_PROVISIONING).getStatus()).isEqualTo(StageStatus.WAITING);
        verify(dispatcher).dispatch(session.getId(), PipelineStage.DATA_AGGREGATION, 1);
    }

    @Test
    void startSession_blankSubject_isRejected() {
        assertThatThrownBy(() -> machine.startSession(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportStageOutcome_everyStagePasses_completesSession() {
        UUID id = machine.startSession("emp-42").getId();

        OutcomeReceipt first = machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92));
        assertThat(first.gateStatus()).isEqualTo(GateStatus.PASSED);
        assertThat(first.stageStatus()).isEqualTo(StageStatus.COMPLETED);
        verify(dispatcher).dispatch(id, PipelineStage.IT_PROVISIONING, 1);

        clock.advance(Duration.ofMinutes(5));
        OutcomeReceipt last = machine.reportStageOutcome(id, PipelineStage.IT_PROVISIONING, completed(88));

        assertThat(last.sessionState()).isEqualTo(SessionState.COMPLETED);
        OnboardingSession session = registry.findSession(id).orElseThrow();
        assertThat(session.getOverallProgress()).isEqualTo(100.0);
        assertThat(session.getCompletedAt()).isEqualTo(MONDAY_10AM.plus(Duration.ofMinutes(5)));
        assertThat(session.getResultJson()).contains("\"state\":\"COMPLETED\"", "\"reason\":\"all stages completed\"");
        assertThat(stage(session, PipelineStage.IT_PROVISIONING).getCheckpointPayload()).contains("quality_score");
    }

    @Test
    void reportStageOutcome_progress_updatesOverallProgress() {
        UUID id = machine.startSession("emp-42").getId();

        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, StageOutcome.progress(50));

        assertThat(registry.findSession(id).orElseThrow().getOverallProgress()).isEqualTo(25.0);
    }

    // ------------------------------------------------------------------
    // Gate outcomes
    // ------------------------------------------------------------------

    @Test
    void reportStageOutcome_lowScore_escalatesForManualReview() {
        UUID id = machine.startSession("emp-42").getId();

        OutcomeReceipt receipt = machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(75.5));

        assertThat(receipt.gateStatus()).isEqualTo(GateStatus.MANUAL_REVIEW);
        assertThat(receipt.stageStatus()).isEqualTo(StageStatus.ESCALATED);
        assertThat(receipt.sessionState()).isEqualTo(SessionState.RUNNING);
        assertThat(registry.escalations(id)).singleElement().satisfies(e -> {
            assertThat(e.getRuleId()).isEqualTo("direct_quality_failure");
            assertThat(e.getLevel()).isEqualTo(EscalationLevel.WARNING);
            assertThat(e.isPendingAck()).isTrue();
        });
        verify(dispatcher, never()).dispatch(id, PipelineStage.IT_PROVISIONING, 1);
    }

    @Test
    void bypassGate_authorizedLevel_completesEscalatedStage() {
        UUID id = machine.startSession("emp-42").getId();
        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(75.5));

        OutcomeReceipt receipt = machine.bypassGate(id, PipelineStage.DATA_AGGREGATION,
                new BypassRequest("director", "laptop ships tomorrow", "alex"));

        assertThat(receipt.gateStatus()).isEqualTo(GateStatus.BYPASS);
        assertThat(receipt.stageStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(registry.gateResults(id)).extracting(QualityGateRecord::getStatus)
                .containsExactly(GateStatus.MANUAL_REVIEW, GateStatus.BYPASS);
        verify(dispatcher).dispatch(id, PipelineStage.IT_PROVISIONING, 1);
    }

    @Test
    void bypassGate_insufficientLevel_isRejectedAndStageStaysEscalated() {
        UUID id = machine.startSession("emp-42").getId();
        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(75.5));

        assertThatThrownBy(() -> machine.bypassGate(id, PipelineStage.DATA_AGGREGATION,
                new BypassRequest("operator", "please", "sam")))
                .isInstanceOf(BypassRejectedException.class)
                .hasMessageContaining("level 'operator' does not cover required level 'manager'");

        assertThat(stage(id, PipelineStage.DATA_AGGREGATION).getStatus()).isEqualTo(StageStatus.ESCALATED);
        assertThat(registry.escalations(id)).hasSize(1);
    }

    @Test
    void bypassGate_stageNotEscalated_isIllegal() {
        UUID id = machine.startSession("emp-42").getId();

        assertThatThrownBy(() -> machine.bypassGate(id, PipelineStage.DATA_AGGREGATION,
                new BypassRequest("director", "why not", "alex")))
                .isInstanceOf(IllegalStageTransitionException.class);
    }

    @Test
    void reportStageOutcome_hardBlockWithoutRetries_failsSession() {
        build(TestConfigs.withGate(TestConfigs.config(), PipelineStage.DATA_AGGREGATION,
                TestConfigs.gate(FailureAction.BLOCK, 0)));
        UUID id = machine.startSession("emp-42").getId();

        OutcomeReceipt receipt = machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(40));

        assertThat(receipt.gateStatus()).isEqualTo(GateStatus.FAILED);
        assertThat(receipt.sessionState()).isEqualTo(SessionState.FAILED_REQUIRES_RECOVERY);
        OnboardingSession session = registry.findSession(id).orElseThrow();
        assertThat(session.getTerminalReason()).startsWith("quality gate for DATA_AGGREGATION still failing");
        assertThat(session.getResultJson()).contains("\"state\":\"FAILED_REQUIRES_RECOVERY\"");
    }

    // ------------------------------------------------------------------
    // Idempotency and ordering
    // ------------------------------------------------------------------

    @Test
    void reportStageOutcome_samePayloadTwice_isDuplicateNoOp() {
        UUID id = machine.startSession("emp-42").getId();
        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92));

        OutcomeReceipt again = machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92));

        assertThat(again.duplicate()).isTrue();
        assertThat(again.gateStatus()).isEqualTo(GateStatus.PASSED);
        assertThat(registry.gateResults(id)).hasSize(1);
    }

    @Test
    void reportStageOutcome_samePayloadWithKeysReordered_isDuplicateNoOp() {
        UUID id = machine.startSession("emp-42").getId();
        ObjectNode first = json.createObjectNode();
        first.put("done", true);
        first.put("quality_score", 92);
        first.putObject("employee").put("id", "E-1001").put("dept", "ops");
        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, StageOutcome.completed(first));

        ObjectNode reordered = json.createObjectNode();
        reordered.putObject("employee").put("dept", "ops").put("id", "E-1001");
        reordered.put("quality_score", 92);
        reordered.put("done", true);
        OutcomeReceipt again = machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION,
                StageOutcome.completed(reordered));

        assertThat(again.duplicate()).isTrue();
        assertThat(registry.gateResults(id)).hasSize(1);
    }

    @Test
    void reportStageOutcome_differentPayloadForCompletedStage_isIllegal() {
        UUID id = machine.startSession("emp-42").getId();
        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92));

        assertThatThrownBy(() -> machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(95)))
                .isInstanceOf(IllegalStageTransitionException.class)
                .hasMessageContaining("already completed");
    }

    @Test
    void reportStageOutcome_notTheCurrentStage_isIllegal() {
        UUID id = machine.startSession("emp-42").getId();

        assertThatThrownBy(() -> machine.reportStageOutcome(id, PipelineStage.IT_PROVISIONING, completed(92)))
                .isInstanceOf(IllegalStageTransitionException.class)
                .hasMessageContaining("not the current stage");
    }

    @Test
    void reportStageOutcome_unknownSession_throwsNotFound() {
        assertThatThrownBy(() -> machine.reportStageOutcome(UUID.randomUUID(),
                PipelineStage.DATA_AGGREGATION, completed(92)))
                .isInstanceOf(SessionNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Failures and recovery
    // ------------------------------------------------------------------

    @Test
    void reportStageOutcome_failedStage_isRetriedAutomatically() throws Exception {
        UUID id = machine.startSession("emp-42").getId();

        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION,
                StageOutcome.failed(List.of(new StageError("TIMEOUT", "directory sync timed out"))));
        RecoveryResult result = awaitRecovery(id);

        assertThat(result.succeeded()).isTrue();
        assertThat(stage(id, PipelineStage.DATA_AGGREGATION).getStatus()).isEqualTo(StageStatus.PROCESSING);
        verify(dispatcher).dispatch(id, PipelineStage.DATA_AGGREGATION, 2);
    }

    @Test
    void reportStageOutcome_retriesExhausted_failsSessionWithResult() throws Exception {
        doNothing()
                .doThrow(new CollaboratorException("worker gateway returned 503"))
                .when(dispatcher).dispatch(any(), any(), anyInt());
        UUID id = machine.startSession("emp-42").getId();

        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION,
                StageOutcome.failed(List.of(new StageError("NETWORK", "connection reset"))));
        RecoveryResult result = awaitRecovery(id);

        assertThat(result.escalationRequired()).isTrue();
        OnboardingSession session = registry.findSession(id).orElseThrow();
        assertThat(session.getState()).isEqualTo(SessionState.FAILED_REQUIRES_RECOVERY);
        assertThat(session.getTerminalReason()).startsWith("retry budget exhausted");
        assertThat(session.getResultJson())
                .contains("\"state\":\"FAILED_REQUIRES_RECOVERY\"", "NETWORK: connection reset");
        assertThat(registry.escalations(id)).extracting(EscalationEvent::getRuleId)
                .contains("direct_stage_failure");
        assertThat(machine.pendingRecovery(id)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Operator controls
    // ------------------------------------------------------------------

    @Test
    void cancel_runningSession_isTerminalAndIdempotent() {
        UUID id = machine.startSession("emp-42").getId();

        OnboardingSession cancelled = machine.cancel(id, null);
        OnboardingSession again     = machine.cancel(id, "twice");

        assertThat(cancelled.getState()).isEqualTo(SessionState.CANCELLED);
        assertThat(again.getTerminalReason()).isEqualTo("cancelled by operator");
        assertThatThrownBy(() -> machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92)))
                .isInstanceOf(SessionClosedException.class);
    }

    @Test
    void pause_thenCompletion_nextStageWaitsForResume() {
        UUID id = machine.startSession("emp-42").getId();
        machine.pause(id, "hiring freeze review");

        OutcomeReceipt receipt = machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92));

        assertThat(receipt.sessionState()).isEqualTo(SessionState.PAUSED);
        assertThat(stage(id, PipelineStage.IT_PROVISIONING).getStatus()).isEqualTo(StageStatus.WAITING);
        verify(dispatcher, never()).dispatch(id, PipelineStage.IT_PROVISIONING, 1);

        OnboardingSession resumed = machine.resume(id);

        assertThat(resumed.getState()).isEqualTo(SessionState.RUNNING);
        verify(dispatcher).dispatch(id, PipelineStage.IT_PROVISIONING, 1);
    }

    @Test
    void extendSla_sameExtensionTwice_appliesOnce() {
        UUID id = machine.startSession("emp-42").getId();

        machine.extendSla(id, PipelineStage.DATA_AGGREGATION, "ext-1");
        StageView view = machine.extendSla(id, PipelineStage.DATA_AGGREGATION, "ext-1");

        assertThat(view.extensionsUsed()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Monitoring
    // ------------------------------------------------------------------

    @Test
    void monitor_criticalBreach_pausesSession() {
        UUID id = machine.startSession("emp-42").getId();
        clock.advance(Duration.ofMinutes(26));

        machine.monitor(id);

        OnboardingSession session = registry.findSession(id).orElseThrow();
        assertThat(session.getState()).isEqualTo(SessionState.PAUSED);
        assertThat(registry.escalations(id)).singleElement().satisfies(e -> {
            assertThat(e.getRuleId()).isEqualTo("critical_sla_breach");
            assertThat(e.getActionsExecuted()).contains("PAUSE_PIPELINE", "CREATE_INCIDENT INC-1");
        });
    }

    @Test
    void monitor_stageCompletedAfterBreach_doesNotEscalateFinishedStage() {
        UUID id = machine.startSession("emp-42").getId();
        clock.advance(Duration.ofMinutes(26));
        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92));

        machine.monitor(id);

        assertThat(registry.findSession(id).orElseThrow().getState()).isEqualTo(SessionState.RUNNING);
        assertThat(registry.escalations(id)).isEmpty();
        verify(operations, never()).createIncident(any());
    }

    @Test
    void monitor_completedAtRiskStage_doesNotCountTowardsCompoundRules() {
        UUID id = machine.startSession("emp-42").getId();
        clock.advance(Duration.ofMinutes(13));
        machine.reportStageOutcome(id, PipelineStage.DATA_AGGREGATION, completed(92));
        clock.advance(Duration.ofMinutes(13));

        machine.monitor(id);

        assertThat(registry.escalations(id)).singleElement().satisfies(e -> {
            assertThat(e.getRuleId()).isEqualTo("sla_at_risk");
            assertThat(e.getStage()).isEqualTo(PipelineStage.IT_PROVISIONING);
        });
        assertThat(machine.getSessionSnapshot(id).slaResults())
                .extracting(SlaResult::stage, SlaResult::status)
                .containsExactly(tuple(PipelineStage.DATA_AGGREGATION, SlaStatus.AT_RISK),
                                 tuple(PipelineStage.IT_PROVISIONING, SlaStatus.AT_RISK));
    }

    @Test
    void getSessionSnapshot_reflectsCurrentStageAndSla() {
        UUID id = machine.startSession("emp-42").getId();
        clock.advance(Duration.ofMinutes(13));
        machine.monitor(id);

        SessionSnapshot snapshot = machine.getSessionSnapshot(id);

        assertThat(snapshot.currentStage()).isEqualTo(PipelineStage.DATA_AGGREGATION);
        assertThat(snapshot.stages()).hasSize(2);
        assertThat(snapshot.slaResults()).singleElement()
                .satisfies(sla -> assertThat(sla.elapsedMinutes()).isEqualTo(13.0));
        assertThat(snapshot.recoveryInProgress()).isFalse();
        assertThat(snapshot.escalationEvents())
                .extracting(EscalationEvent::getRuleId).containsExactly("sla_at_risk");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StageOutcome completed(double score) {
        JsonNode payload = json.createObjectNode()
                .put("done", true)
                .put("quality_score", score);
        return StageOutcome.completed(payload);
    }

    private StageRecord stage(OnboardingSession session, PipelineStage stage) {
        return stage(session.getId(), stage);
    }

    private StageRecord stage(UUID id, PipelineStage stage) {
        return registry.stage(id, stage).orElseThrow();
    }

    private RecoveryResult awaitRecovery(UUID id) throws Exception {
        CompletableFuture<RecoveryResult> future = machine.pendingRecovery(id).orElseThrow();
        return future.get(5, TimeUnit.SECONDS);
    }
}
