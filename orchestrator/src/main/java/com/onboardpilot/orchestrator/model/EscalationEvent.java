package com.onboardpilot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A fired escalation.
 *
 * The engine fills in delivery and action results before the first save.
 * After that only {@link #acknowledge} and {@link #resolve} change it.
 *
 * DB table: escalation_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "escalation_events")
public class EscalationEvent {

    @Id
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    // Rule table id, or a synthetic id for dynamic and direct escalations.
    @Column(name = "rule_id", nullable = false, updatable = false)
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EscalationLevel level;

    // Stage that triggered the event; null for session-wide triggers.
    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private PipelineStage stage;

    @Column(name = "trigger_reason", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String triggerReason;

    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private String message;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> recipients;

    @Column(nullable = false, updatable = false)
    private boolean dynamic;

    @Column(name = "notification_id")
    private String notificationId;

    @Column(name = "notification_delivered", nullable = false)
    private boolean notificationDelivered = false;

    @Convert(converter = StringListConverter.class)
    @Column(name = "actions_executed", columnDefinition = "TEXT", nullable = false)
    private List<String> actionsExecuted = new ArrayList<>();

    @Column(name = "incident_ticket_id")
    private String incidentTicketId;

    @Column(name = "requires_ack", nullable = false)
    private boolean requiresAck;

    @Column(nullable = false)
    private boolean acknowledged = false;

    @Column(name = "acknowledged_by")
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected EscalationEvent() {}   // required by JPA

    public EscalationEvent(UUID sessionId, String ruleId, EscalationLevel level, PipelineStage stage,
                           String triggerReason, String message, List<String> recipients,
                           boolean requiresAck, boolean dynamic, Instant createdAt) {
        this.id            = UUID.randomUUID();
        this.sessionId     = sessionId;
        this.ruleId        = ruleId;
        this.level         = level;
        this.stage         = stage;
        this.triggerReason = triggerReason;
        this.message       = message;
        this.recipients    = new ArrayList<>(recipients);
        this.requiresAck   = requiresAck;
        this.dynamic       = dynamic;
        this.createdAt     = createdAt;
    }

    // ------------------------------------------------------------------
    // Firing (before first save)
    // ------------------------------------------------------------------

    public void recordDelivery(String notificationId) {
        this.notificationId        = notificationId;
        this.notificationDelivered = notificationId != null;
    }

    public void recordAction(String action)        { this.actionsExecuted.add(action); }
    public void setIncidentTicketId(String ticket) { this.incidentTicketId = ticket; }
    public void requireAck()                       { this.requiresAck = true; }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    public void acknowledge(String operator, Instant at) {
        this.acknowledged   = true;
        this.acknowledgedBy = operator;
        this.acknowledgedAt = at;
    }

    /** Resolving implies acknowledging. */
    public void resolve(String operator, String notes, Instant at) {
        if (!acknowledged) acknowledge(operator, at);
        this.resolvedBy      = operator;
        this.resolutionNotes = notes;
        this.resolvedAt      = at;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID            getId()                    { return id; }
    public UUID            getSessionId()             { return sessionId; }
    public String          getRuleId()                { return ruleId; }
    public EscalationLevel getLevel()                 { return level; }
    public PipelineStage   getStage()                 { return stage; }
    public String          getTriggerReason()         { return triggerReason; }
    public String          getMessage()               { return message; }
    public List<String>    getRecipients()            { return List.copyOf(recipients); }
    public boolean         isDynamic()                { return dynamic; }
    public String          getNotificationId()        { return notificationId; }
    public boolean         isNotificationDelivered()  { return notificationDelivered; }
    public List<String>    getActionsExecuted()       { return List.copyOf(actionsExecuted); }
    public String          getIncidentTicketId()      { return incidentTicketId; }
    public boolean         isRequiresAck()            { return requiresAck; }
    public boolean         isAcknowledged()           { return acknowledged; }
    public String          getAcknowledgedBy()        { return acknowledgedBy; }
    public Instant         getAcknowledgedAt()        { return acknowledgedAt; }
    public String          getResolvedBy()            { return resolvedBy; }
    public Instant         getResolvedAt()            { return resolvedAt; }
    public String          getResolutionNotes()       { return resolutionNotes; }
    public Instant         getCreatedAt()             { return createdAt; }

    public boolean isResolved()       { return resolvedAt != null; }
    public boolean isPendingAck()     { return requiresAck && !acknowledged; }
}
