package com.onboardpilot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One executed recovery action. Written once when the action finishes and
 * never updated afterwards.
 *
 * DB table: recovery_attempts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "recovery_attempts")
public class RecoveryAttempt {

    @Id
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelineStage stage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private RecoveryStrategy strategy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private RecoveryAction action;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AttemptStatus status;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at", nullable = false, updatable = false)
    private Instant completedAt;

    @Column(name = "duration_seconds", nullable = false, updatable = false)
    private double durationSeconds;

    @Column(name = "result_payload", columnDefinition = "TEXT", updatable = false)
    private String resultPayload;

    @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    protected RecoveryAttempt() {}   // required by JPA

    public RecoveryAttempt(UUID sessionId, PipelineStage stage, RecoveryStrategy strategy,
                           RecoveryAction action, int attemptNumber, AttemptStatus status,
                           Instant startedAt, Instant completedAt,
                           String resultPayload, String errorMessage) {
        this.id              = UUID.randomUUID();
        this.sessionId       = sessionId;
        this.stage           = stage;
        this.strategy        = strategy;
        this.action          = action;
        this.attemptNumber   = attemptNumber;
        this.status          = status;
        this.startedAt       = startedAt;
        this.completedAt     = completedAt;
        this.durationSeconds = Duration.between(startedAt, completedAt).toMillis() / 1000.0;
        this.resultPayload   = resultPayload;
        this.errorMessage    = errorMessage;
    }

    public UUID             getId()              { return id; }
    public UUID             getSessionId()       { return sessionId; }
    public PipelineStage    getStage()           { return stage; }
    public RecoveryStrategy getStrategy()        { return strategy; }
    public RecoveryAction   getAction()          { return action; }
    public int              getAttemptNumber()   { return attemptNumber; }
    public AttemptStatus    getStatus()          { return status; }
    public Instant          getStartedAt()       { return startedAt; }
    public Instant          getCompletedAt()     { return completedAt; }
    public double           getDurationSeconds() { return durationSeconds; }
    public String           getResultPayload()   { return resultPayload; }
    public String           getErrorMessage()    { return errorMessage; }

    public boolean succeeded() { return status == AttemptStatus.SUCCEEDED; }
}
