package com.onboardpilot.orchestrator.registry;

import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.QualityGateRecord;
import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import com.onboardpilot.orchestrator.model.SessionState;
import com.onboardpilot.orchestrator.model.StageRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry kept entirely in process memory. Used for local runs
 * ({@code onboardpilot.registry.type=memory}) and by the state machine tests.
 *
 * Each session owns one {@link Partition}; nothing is shared between
 * sessions apart from the escalation id index.
 */
@Component
@ConditionalOnProperty(name = "onboardpilot.registry.type", havingValue = "memory")
public class InMemoryStageRegistry implements StageRegistry {

    private final Map<UUID, Partition> partitions  = new ConcurrentHashMap<>();
    private final Map<UUID, UUID>      escalations = new ConcurrentHashMap<>();   // event id → session id

    /** Everything stored for one session. */
    private static final class Partition {
        volatile OnboardingSession                         session;
        final Map<PipelineStage, StageRecord>              stages      = new ConcurrentHashMap<>();
        final List<QualityGateRecord>                      gateResults = new CopyOnWriteArrayList<>();
        final Map<UUID, EscalationEvent>                   events      = new ConcurrentHashMap<>();
        final List<EscalationEvent>                        eventOrder  = new CopyOnWriteArrayList<>();
        final List<RecoveryAttempt>                        attempts    = new CopyOnWriteArrayList<>();

        Partition(OnboardingSession session) {
            this.session = session;
        }
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    @Override
    public OnboardingSession createSession(OnboardingSession session, List<StageRecord> stages) {
        Partition partition = new Partition(session);
        for (StageRecord record : stages) {
            partition.stages.put(record.getStage(), record);
        }
        if (partitions.putIfAbsent(session.getId(), partition) != null) {
            throw new IllegalStateException("Session " + session.getId() + " already exists");
        }
        return session;
    }

    @Override
    public Optional<OnboardingSession> findSession(UUID sessionId) {
        Partition partition = partitions.get(sessionId);
        return partition == null ? Optional.empty() : Optional.of(partition.session);
    }

    @Override
    public OnboardingSession saveSession(OnboardingSession session) {
        partition(session.getId()).session = session;
        return session;
    }

    @Override
    public List<OnboardingSession> findSessionsByState(SessionState state) {
        return partitions.values().stream()
                .map(p -> p.session)
                .filter(s -> s.getState() == state)
                .sorted(Comparator.comparing(OnboardingSession::getStartedAt))
                .toList();
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    @Override
    public List<StageRecord> stages(UUID sessionId) {
        Partition partition = partitions.get(sessionId);
        if (partition == null) return List.of();
        return partition.stages.values().stream()
                .sorted(Comparator.comparingInt(StageRecord::getPosition))
                .toList();
    }

    @Override
    public Optional<StageRecord> stage(UUID sessionId, PipelineStage stage) {
        Partition partition = partitions.get(sessionId);
        return partition == null ? Optional.empty() : Optional.ofNullable(partition.stages.get(stage));
    }

    @Override
    public StageRecord saveStage(StageRecord record) {
        partition(record.getSessionId()).stages.put(record.getStage(), record);
        return record;
    }

    @Override
    public StageRecord resetStage(StageRecord record) {
        record.reset();
        return saveStage(record);
    }

    // ------------------------------------------------------------------
    // Gate results / escalations / recovery
    // ------------------------------------------------------------------

    @Override
    public QualityGateRecord saveGateResult(QualityGateRecord record) {
        partition(record.getSessionId()).gateResults.add(record);
        return record;
    }

    @Override
    public List<QualityGateRecord> gateResults(UUID sessionId) {
        Partition partition = partitions.get(sessionId);
        return partition == null ? List.of() : List.copyOf(partition.gateResults);
    }

    @Override
    public EscalationEvent saveEscalation(EscalationEvent event) {
        Partition partition = partition(event.getSessionId());
        if (partition.events.put(event.getId(), event) == null) {
            partition.eventOrder.add(event);
        }
        escalations.put(event.getId(), event.getSessionId());
        return event;
    }

    @Override
    public Optional<EscalationEvent> findEscalation(UUID eventId) {
        UUID sessionId = escalations.get(eventId);
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(partition(sessionId).events.get(eventId));
    }

    @Override
    public List<EscalationEvent> escalations(UUID sessionId) {
        Partition partition = partitions.get(sessionId);
        return partition == null ? List.of() : List.copyOf(partition.eventOrder);
    }

    @Override
    public RecoveryAttempt saveAttempt(RecoveryAttempt attempt) {
        partition(attempt.getSessionId()).attempts.add(attempt);
        return attempt;
    }

    @Override
    public List<RecoveryAttempt> attempts(UUID sessionId) {
        Partition partition = partitions.get(sessionId);
        return partition == null ? List.of() : List.copyOf(partition.attempts);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Partition partition(UUID sessionId) {
        Partition partition = partitions.get(sessionId);
        if (partition == null) {
            throw new IllegalStateException("Unknown session " + sessionId);
        }
        return partition;
    }
}
