package com.onboardpilot.orchestrator.registry;

import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.model.StageError;
import com.onboardpilot.orchestrator.model.StageRecord;
import com.onboardpilot.orchestrator.model.StageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStageRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private InMemoryStageRegistry registry;
    private OnboardingSession     session;

    @BeforeEach
    void setUp() {
        registry = new InMemoryStageRegistry();
        session  = new OnboardingSession("emp-42", "test-1", NOW);
        registry.createSession(session, List.of(
                new StageRecord(session.getId(), PipelineStage.IT_PROVISIONING, 2),
                new StageRecord(session.getId(), PipelineStage.DATA_COLLECTION, 0),
                new StageRecord(session.getId(), PipelineStage.DATA_AGGREGATION, 1)));
    }

    // ------------------------------------------------------------------
    // Sessions and stages
    // ------------------------------------------------------------------

    @Test
    void createSession_sameIdTwice_throwsIllegalState() {
        assertThatThrownBy(() -> registry.createSession(session, List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void stages_returnedInPipelineOrder() {
        assertThat(registry.stages(session.getId()))
                .extracting(StageRecord::getStage)
                .containsExactly(PipelineStage.DATA_COLLECTION,
                                 PipelineStage.DATA_AGGREGATION,
                                 PipelineStage.IT_PROVISIONING);
    }

    @Test
    void stages_unknownSession_returnsEmpty() {
        UUID unknown = UUID.randomUUID();

        assertThat(registry.stages(unknown)).isEmpty();
        assertThat(registry.findSession(unknown)).isEmpty();
        assertThat(registry.stage(unknown, PipelineStage.DATA_COLLECTION)).isEmpty();
    }

    @Test
    void saveStage_unknownSession_throwsIllegalState() {
        StageRecord orphan = new StageRecord(UUID.randomUUID(), PipelineStage.DATA_COLLECTION, 0);

        assertThatThrownBy(() -> registry.saveStage(orphan))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Unknown session");
    }

    @Test
    void resetStage_failedStage_returnsToWaitingButKeepsErrorHistory() {
        StageRecord record = registry.stage(session.getId(), PipelineStage.DATA_COLLECTION).orElseThrow();
        record.transitionTo(StageStatus.PROCESSING, NOW);
        record.recordErrors(List.of(new StageError("NETWORK", "connection reset")));
        record.transitionTo(StageStatus.FAILED, NOW.plusSeconds(30));
        registry.saveStage(record);

        StageRecord reset = registry.resetStage(record);

        assertThat(reset.getStatus()).isEqualTo(StageStatus.WAITING);
        assertThat(reset.getStartedAt()).isNull();
        assertThat(reset.getErrorCount()).isEqualTo(1);
    }

    @Test
    void findSessionsByState_filtersAndOrdersByStart() {
        OnboardingSession later = new OnboardingSession("emp-43", "test-1", NOW.plusSeconds(60));
        registry.createSession(later, List.of());
        session.setState(SessionState.RUNNING);
        later.setState(SessionState.RUNNING);
        registry.saveSession(session);
        registry.saveSession(later);

        assertThat(registry.findSessionsByState(SessionState.RUNNING))
                .extracting(OnboardingSession::getSubjectId)
                .containsExactly("emp-42", "emp-43");
        assertThat(registry.findSessionsByState(SessionState.PAUSED)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Escalations
    // ------------------------------------------------------------------

    @Test
    void saveEscalation_updatedTwice_keptOnceInCreationOrder() {
        EscalationEvent first  = escalation("sla_at_risk");
        EscalationEvent second = escalation("critical_sla_breach");
        registry.saveEscalation(first);
        registry.saveEscalation(second);

        first.acknowledge("dana", NOW.plusSeconds(120));
        registry.saveEscalation(first);

        assertThat(registry.escalations(session.getId()))
                .extracting(EscalationEvent::getRuleId)
                .containsExactly("sla_at_risk", "critical_sla_breach");
        assertThat(registry.findEscalation(first.getId()))
                .get()
                .extracting(EscalationEvent::getAcknowledgedBy)
                .isEqualTo("dana");
    }

    @Test
    void findEscalation_unknownId_returnsEmpty() {
        assertThat(registry.findEscalation(UUID.randomUUID())).isEmpty();
    }

    private EscalationEvent escalation(String ruleId) {
        return new EscalationEvent(session.getId(), ruleId, EscalationLevel.WARNING,
                PipelineStage.DATA_COLLECTION, "SLA AT_RISK", ruleId, List.of("operations_team"),
                false, false, NOW);
    }
}
