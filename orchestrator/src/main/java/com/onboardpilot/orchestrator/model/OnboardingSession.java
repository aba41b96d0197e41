package com.onboardpilot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One onboarding workflow instance for one subject (the new employee).
 *
 * Owned by the PipelineStateMachine: created at start, mutated on every
 * stage transition, and kept (read-only) once it reaches a terminal state.
 *
 * DB table: onboarding_sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "onboarding_sessions")
public class OnboardingSession {

    // Assigned here rather than by JPA so the in-memory registry can use the same entity.
    @Id
    private UUID id;

    @Column(name = "subject_id", nullable = false)
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionState state = SessionState.INITIATED;

    // Index into the configured stage order. Only moves backwards through a recovery reset.
    @Column(name = "current_stage_index", nullable = false)
    private int currentStageIndex = 0;

    @Column(name = "overall_progress", nullable = false)
    private double overallProgress = 0.0;

    // Set after a PARTIAL recovery: the session keeps running with reduced guarantees.
    @Column(nullable = false)
    private boolean degraded = false;

    @Column(name = "workflow_resumptions", nullable = false)
    private int workflowResumptions = 0;

    // Version of the resilience configuration the session was started under.
    @Column(name = "config_version", nullable = false)
    private String configVersion;

    @Column(name = "terminal_reason", columnDefinition = "TEXT")
    private String terminalReason;

    // Last known status of every stage, written once the session is terminal.
    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected OnboardingSession() {}   // required by JPA

    public OnboardingSession(String subjectId, String configVersion, Instant startedAt) {
        this.id            = UUID.randomUUID();
        this.subjectId     = subjectId;
        this.configVersion = configVersion;
        this.startedAt     = startedAt;
        this.updatedAt     = startedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()                  { return id; }
    public String       getSubjectId()           { return subjectId; }
    public SessionState getState()               { return state; }
    public int          getCurrentStageIndex()   { return currentStageIndex; }
    public double       getOverallProgress()     { return overallProgress; }
    public boolean      isDegraded()             { return degraded; }
    public int          getWorkflowResumptions() { return workflowResumptions; }
    public String       getConfigVersion()       { return configVersion; }
    public String       getTerminalReason()      { return terminalReason; }
    public String       getResultJson()          { return resultJson; }
    public Instant      getStartedAt()           { return startedAt; }
    public Instant      getUpdatedAt()           { return updatedAt; }
    public Instant      getCompletedAt()         { return completedAt; }

    public void setState(SessionState state)              { this.state = state; }
    public void setCurrentStageIndex(int index)           { this.currentStageIndex = index; }
    public void setOverallProgress(double progress)       { this.overallProgress = progress; }
    public void markDegraded()                            { this.degraded = true; }
    public void incrementWorkflowResumptions()            { this.workflowResumptions++; }
    public void setTerminalReason(String reason)          { this.terminalReason = reason; }
    public void setResultJson(String resultJson)          { this.resultJson = resultJson; }
    public void setCompletedAt(Instant t)                 { this.completedAt = t; }
    public void touch(Instant t)                          { this.updatedAt = t; }

    public boolean isTerminal() { return state.isTerminal(); }
}
