package com.onboardpilot.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Durable record of one stage within one session.
 *
 * Status changes go through {@link #transitionTo}, which only allows forward
 * moves. {@link #reset} is the single way back to WAITING and is reserved
 * for recovery.
 *
 * DB table: stage_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_records")
public class StageRecord {

    @Id
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelineStage stage;

    // Position of this stage in the session's configured order.
    @Column(nullable = false, updatable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageStatus status = StageStatus.WAITING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_count", nullable = false)
    private int errorCount = 0;

    // "CODE: message" entries, oldest first.
    @Convert(converter = StringListConverter.class)
    @Column(name = "errors", columnDefinition = "TEXT", nullable = false)
    private List<String> errors = new ArrayList<>();

    @Column(name = "output_payload", columnDefinition = "TEXT")
    private String outputPayload;

    @Column(name = "progress_percent", nullable = false)
    private double progressPercent = 0.0;

    // Re-dispatches issued by recovery or an operator.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "extensions_used", nullable = false)
    private int extensionsUsed = 0;

    @Convert(converter = StringListConverter.class)
    @Column(name = "applied_extension_ids", columnDefinition = "TEXT", nullable = false)
    private List<String> appliedExtensionIds = new ArrayList<>();

    // Last payload accepted by the quality gate; state restoration rolls back to it.
    @Column(name = "checkpoint_payload", columnDefinition = "TEXT")
    private String checkpointPayload;

    @Column(name = "checkpointed_at")
    private Instant checkpointedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StageRecord() {}   // required by JPA

    public StageRecord(UUID sessionId, PipelineStage stage, int position) {
        this.id        = UUID.randomUUID();
        this.sessionId = sessionId;
        this.stage     = stage;
        this.position  = position;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}, rejecting anything that is not a forward move.
     *
     * @throws IllegalStateException when the move is not allowed from the current status
     */
    public void transitionTo(StageStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Stage " + stage + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        if (next == StageStatus.PROCESSING) {
            this.startedAt = now;
            this.completedAt = null;
        } else if (next == StageStatus.COMPLETED) {
            this.completedAt = now;
            this.progressPercent = 100.0;
        }
    }

    /**
     * Put the stage back to WAITING with a clean slate for output and progress.
     * Error history and counters are kept so retry budgets still hold.
     */
    public void reset() {
        this.status          = StageStatus.WAITING;
        this.startedAt       = null;
        this.completedAt     = null;
        this.outputPayload   = null;
        this.progressPercent = 0.0;
    }

    public void recordErrors(List<StageError> newErrors) {
        for (StageError e : newErrors) {
            errors.add(e.code() + ": " + e.message());
        }
        errorCount += newErrors.size();
    }

    /**
     * Record an SLA extension.
     *
     * @return false when this extension id was already applied
     */
    public boolean applyExtension(String extensionId) {
        if (appliedExtensionIds.contains(extensionId)) return false;
        appliedExtensionIds.add(extensionId);
        extensionsUsed++;
        return true;
    }

    public void checkpoint(Instant now) {
        this.checkpointPayload = outputPayload;
        this.checkpointedAt    = now;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                  { return id; }
    public UUID          getSessionId()           { return sessionId; }
    public PipelineStage getStage()               { return stage; }
    public int           getPosition()            { return position; }
    public StageStatus   getStatus()              { return status; }
    public Instant       getStartedAt()           { return startedAt; }
    public Instant       getCompletedAt()         { return completedAt; }
    public int           getErrorCount()          { return errorCount; }
    public List<String>  getErrors()              { return List.copyOf(errors); }
    public String        getOutputPayload()       { return outputPayload; }
    public double        getProgressPercent()     { return progressPercent; }
    public int           getRetryCount()          { return retryCount; }
    public int           getExtensionsUsed()      { return extensionsUsed; }
    public List<String>  getAppliedExtensionIds() { return List.copyOf(appliedExtensionIds); }
    public String        getCheckpointPayload()   { return checkpointPayload; }
    public Instant       getCheckpointedAt()      { return checkpointedAt; }

    public void setOutputPayload(String payload)         { this.outputPayload = payload; }
    public void setProgressPercent(double progress)      { this.progressPercent = Math.max(0.0, Math.min(100.0, progress)); }
    public void incrementRetryCount()                    { this.retryCount++; }
}
