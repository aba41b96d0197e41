package com.onboardpilot.orchestrator.repository;

import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.StageRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD for the stage_records table. One row per (session, stage).
 */
public interface StageRecordRepository extends JpaRepository<StageRecord, UUID> {

    /** All stages of a session in pipeline order. */
    List<StageRecord> findBySessionIdOrderByPositionAsc(UUID sessionId);

    Optional<StageRecord> findBySessionIdAndStage(UUID sessionId, PipelineStage stage);
}
