package com.onboardpilot.orchestrator.repository;

import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only access to recovery_attempts.
 *
 * An attempt row is written when the attempt finishes, so completion
 * order is creation order.
 */
public interface RecoveryAttemptRepository extends JpaRepository<RecoveryAttempt, UUID> {

    List<RecoveryAttempt> findBySessionIdOrderByCompletedAtAscAttemptNumberAsc(UUID sessionId);
}
