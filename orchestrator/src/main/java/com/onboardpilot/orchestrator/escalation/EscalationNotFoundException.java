package com.onboardpilot.orchestrator.escalation;

import java.util.UUID;

public class EscalationNotFoundException extends RuntimeException {

    public EscalationNotFoundException(UUID eventId) {
        super("Escalation event not found: " + eventId);
    }
}
