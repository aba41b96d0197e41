package com.onboardpilot.orchestrator.api.dto;

import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.PipelineStage;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record EscalationResponse(
        UUID            id,
        String          ruleId,
        EscalationLevel level,
        PipelineStage   stage,
        String          triggerReason,
        String          message,
        List<String>    recipients,
        boolean         dynamic,
        String          notificationId,
        boolean         notificationDelivered,
        List<String>    actionsExecuted,
        String          incidentTicketId,
        boolean         requiresAck,
        boolean         acknowledged,
        String          acknowledgedBy,
        Instant         acknowledgedAt,
        String          resolvedBy,
        Instant         resolvedAt,
        String          resolutionNotes,
        Instant         createdAt
) {
    public static EscalationResponse from(EscalationEvent e) {
        return new EscalationResponse(
                e.getId(),
                e.getRuleId(),
                e.getLevel(),
                e.getStage(),
                e.getTriggerReason(),
                e.getMessage(),
                e.getRecipients(),
                e.isDynamic(),
                e.getNotificationId(),
                e.isNotificationDelivered(),
                e.getActionsExecuted(),
                e.getIncidentTicketId(),
                e.isRequiresAck(),
                e.isAcknowledged(),
                e.getAcknowledgedBy(),
                e.getAcknowledgedAt(),
                e.getResolvedBy(),
                e.getResolvedAt(),
                e.getResolutionNotes(),
                e.getCreatedAt()
        );
    }
}
