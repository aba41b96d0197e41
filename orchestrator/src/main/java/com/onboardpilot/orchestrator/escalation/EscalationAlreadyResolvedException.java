package com.onboardpilot.orchestrator.escalation;

import java.util.UUID;

/**
 * Thrown when an operator tries to resolve an escalation a second time.
 */
public class EscalationAlreadyResolvedException extends RuntimeException {

    public EscalationAlreadyResolvedException(UUID eventId, String resolvedBy) {
        super("Escalation event " + eventId + " was already resolved by " + resolvedBy);
    }
}
