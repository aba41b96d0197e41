package com.onboardpilot.orchestrator.sla;

import com.onboardpilot.orchestrator.model.PipelineStage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SlaSnapshotStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final SlaSnapshotStore store = new SlaSnapshotStore();

    @Test
    void remove_oneStage_keepsTheOthers() {
        UUID id = UUID.randomUUID();
        store.put(id, result(PipelineStage.DATA_AGGREGATION, SlaStatus.AT_RISK));
        store.put(id, result(PipelineStage.IT_PROVISIONING, SlaStatus.ON_TIME));

        store.remove(id, PipelineStage.IT_PROVISIONING);

        assertThat(store.latest(id, PipelineStage.IT_PROVISIONING)).isEmpty();
        assertThat(store.latest(id)).extracting(SlaResult::stage).containsExactly(PipelineStage.DATA_AGGREGATION);
    }

    @Test
    void remove_unknownSessionOrStage_isNoOp() {
        UUID id = UUID.randomUUID();
        store.put(id, result(PipelineStage.DATA_AGGREGATION, SlaStatus.ON_TIME));

        store.remove(UUID.randomUUID(), PipelineStage.DATA_AGGREGATION);
        store.remove(id, PipelineStage.MEETING_COORDINATION);

        assertThat(store.latest(id)).hasSize(1);
    }

    @Test
    void put_sameStageAgain_replacesEarlierResult() {
        UUID id = UUID.randomUUID();
        store.put(id, result(PipelineStage.DATA_AGGREGATION, SlaStatus.ON_TIME));
        store.put(id, result(PipelineStage.DATA_AGGREGATION, SlaStatus.BREACHED));

        assertThat(store.latest(id, PipelineStage.DATA_AGGREGATION))
                .get().extracting(SlaResult::status).isEqualTo(SlaStatus.BREACHED);
    }

    private static SlaResult result(PipelineStage stage, SlaStatus status) {
        SlaConfig.Thresholds t = new SlaConfig.Thresholds(10, 12, 15, 20);
        return new SlaResult(stage, status, 5.0, 5.0, NOW, 0.05, 0, t, NOW);
    }
}
