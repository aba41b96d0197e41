package com.onboardpilot.orchestrator.repository;

import com.onboardpilot.orchestrator.model.EscalationEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface EscalationEventRepository extends JpaRepository<EscalationEvent, UUID> {

    List<EscalationEvent> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);
}
