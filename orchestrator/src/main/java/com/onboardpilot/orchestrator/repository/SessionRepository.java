package com.onboardpilot.orchestrator.repository;

import com.onboardpilot.orchestrator.model.OnboardingSession;
import com.onboardpilot.orchestrator.model.SessionState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the onboarding_sessions table.
 */
public interface SessionRepository extends JpaRepository<OnboardingSession, UUID> {

    /** Sessions in a given state, oldest first (used by the monitor tick). */
    List<OnboardingSession> findByStateOrderByStartedAtAsc(SessionState state);
}
