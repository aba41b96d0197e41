package com.onboardpilot.orchestrator.sla;

import com.onboardpilot.orchestrator.model.PipelineStage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest {@link SlaResult} per (session, stage). Older results are replaced,
 * not kept; aggregated history lives in PipelineMetrics.
 */
@Component
public class SlaSnapshotStore {

    private final Map<UUID, Map<PipelineStage, SlaResult>> latest = new ConcurrentHashMap<>();

    public void put(UUID sessionId, SlaResult result) {
        latest.compute(sessionId, (id, byStage) -> {
            Map<PipelineStage, SlaResult> next = byStage == null
                    ? new EnumMap<>(PipelineStage.class)
                    : new EnumMap<>(byStage);
            next.put(result.stage(), result);
            return next;
        });
    }

    public Optional<SlaResult> latest(UUID sessionId, PipelineStage stage) {
        return Optional.ofNullable(latest.getOrDefault(sessionId, Map.of()).get(stage));
    }

    public List<SlaResult> latest(UUID sessionId) {
        List<SlaResult> results = new ArrayList<>(latest.getOrDefault(sessionId, Map.of()).values());
        results.sort(Comparator.comparing(SlaResult::stage));
        return results;
    }

    /** Forget one stage's result, e.g. when the stage starts a fresh attempt. */
    public void remove(UUID sessionId, PipelineStage stage) {
        latest.computeIfPresent(sessionId, (id, byStage) -> {
            if (!byStage.containsKey(stage)) return byStage;
            Map<PipelineStage, SlaResult> next = new EnumMap<>(byStage);
            next.remove(stage);
            return next;
        });
    }

    /** Drop everything for a session that reached a terminal state. */
    public void remove(UUID sessionId) {
        latest.remove(sessionId);
    }
}
