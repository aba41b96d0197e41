package com.onboardpilot.orchestrator.repository;

import com.onboardpilot.orchestrator.model.QualityGateRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface QualityGateRecordRepository extends JpaRepository<QualityGateRecord, UUID> {

    List<QualityGateRecord> findBySessionIdOrderByEvaluatedAtAscAttemptAsc(UUID sessionId);
}
