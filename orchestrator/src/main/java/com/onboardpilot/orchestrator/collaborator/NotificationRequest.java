package com.onboardpilot.orchestrator.collaborator;

import com.onboardpilot.orchestrator.model.EscalationLevel;

import java.util.List;
import java.util.UUID;

/**
 * One notification to deliver. The channel (mail, chat, pager) is the
 * operations service's concern.
 */
public record NotificationRequest(
        UUID            sessionId,
        List<String>    recipients,
        EscalationLevel level,
        String          message,
        boolean         requiresAck
) {
    public NotificationRequest {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }
}
