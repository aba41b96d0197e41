package com.onboardpilot.orchestrator.model;

import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.gate.QualityGateResult;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted outcome of one gate evaluation. A retry adds a new row with a
 * higher {@code attempt}; existing rows are never updated.
 *
 * DB table: quality_gate_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "quality_gate_results")
public class QualityGateRecord {

    @Id
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelineStage stage;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private GateStatus status;

    @Column(nullable = false, updatable = false)
    private boolean passed;

    @Column(nullable = false, updatable = false)
    private double score;

    @Convert(converter = StringListConverter.class)
    @Column(name = "critical_issues", columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> criticalIssues;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> warnings;

    @Column(name = "bypass_reason", columnDefinition = "TEXT", updatable = false)
    private String bypassReason;

    // Hash of the evaluated payload; a duplicate report of the same payload is recognised by it.
    @Column(name = "payload_hash", nullable = false, updatable = false)
    private String payloadHash;

    @Column(name = "evaluated_at", nullable = false, updatable = false)
    private Instant evaluatedAt;

    protected QualityGateRecord() {}   // required by JPA

    public QualityGateRecord(UUID sessionId, int attempt, QualityGateResult result, String payloadHash) {
        this.id             = UUID.randomUUID();
        this.sessionId      = sessionId;
        this.stage          = result.stage();
        this.attempt        = attempt;
        this.status         = result.status();
        this.passed         = result.passed();
        this.score          = result.score();
        this.criticalIssues = result.criticalIssues();
        this.warnings       = result.warnings();
        this.bypassReason   = result.bypassReason();
        this.payloadHash    = payloadHash;
        this.evaluatedAt    = result.evaluatedAt();
    }

    public UUID          getId()             { return id; }
    public UUID          getSessionId()      { return sessionId; }
    public PipelineStage getStage()          { return stage; }
    public int           getAttempt()        { return attempt; }
    public GateStatus    getStatus()         { return status; }
    public boolean       isPassed()          { return passed; }
    public double        getScore()          { return score; }
    public List<String>  getCriticalIssues() { return List.copyOf(criticalIssues); }
    public List<String>  getWarnings()       { return List.copyOf(warnings); }
    public String        getBypassReason()   { return bypassReason; }
    public String        getPayloadHash()    { return payloadHash; }
    public Instant       getEvaluatedAt()    { return evaluatedAt; }
}
