package com.onboardpilot.orchestrator.pipeline;

import java.util.UUID;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(UUID sessionId) {
        super("Onboarding session not found: " + sessionId);
    }
}
