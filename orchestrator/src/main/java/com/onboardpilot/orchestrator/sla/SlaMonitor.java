package com.onboardpilot.orchestrator.sla;

import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.config.ResilienceConfiguration;
import com.onboardpilot.orchestrator.metrics.PipelineMetrics;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.StageRecord;
import com.onboardpilot.orchestrator.model.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Classifies a stage's elapsed time against its SLA and predicts whether it
 * will breach.
 *
 * Classification only: the monitor never blocks or changes a stage. The
 * state machine and escalation engine decide what to do with a result.
 *
 * Status is chosen top-down against the (extended) thresholds:
 * <pre>
 *   elapsed ≥ breach   → BREACHED
 *   elapsed ≥ critical → AT_RISK
 *   elapsed ≥ warning  → AT_RISK
 *   otherwise          → ON_TIME   (EXTENDED if an extension was consumed)
 * </pre>
 */
@Component
public class SlaMonitor {

    private static final Logger log = LoggerFactory.getLogger(SlaMonitor.class);

    // Each recorded error stretches the predicted total by 20%.
    static final double ERROR_PENALTY = 0.2;

    // Progress below 1% is treated as 1% so the extrapolation stays finite.
    static final double MIN_PROGRESS = 1.0;

    private final ConfigurationRegistry config;
    private final PipelineMetrics       metrics;

    public SlaMonitor(ConfigurationRegistry config, PipelineMetrics metrics) {
        this.config  = config;
        this.metrics = metrics;
    }

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    /**
     * Evaluate a stage record with the active configuration. A completed
     * stage is measured up to its completion time.
     *
     * @throws IllegalArgumentException if the stage has not started yet
     */
    public SlaResult evaluate(StageRecord record, Instant now) {
        if (record.getStartedAt() == null) {
            throw new IllegalArgumentException("Stage " + record.getStage() + " has not started");
        }
        boolean completed = record.getStatus() == StageStatus.COMPLETED;
        Instant end = completed && record.getCompletedAt() != null ? record.getCompletedAt() : now;
        SlaProgress progress = new SlaProgress(
                record.getProgressPercent(),
                record.getErrorCount(),
                record.getExtensionsUsed(),
                completed);
        return evaluate(record.getStage(), config.current().sla(record.getStage()),
                record.getStartedAt(), end, progress);
    }

    public SlaResult evaluate(PipelineStage stage, SlaConfig sla, Instant startedAt, Instant now) {
        return evaluate(stage, sla, startedAt, now, SlaProgress.none());
    }

    public SlaResult evaluate(PipelineStage stage,
                              SlaConfig sla,
                              Instant startedAt,
                              Instant now,
                              SlaProgress progress) {
        double elapsed = round(elapsedMinutes(sla, startedAt, now));
        SlaConfig.Thresholds t = sla.effectiveThresholds(progress.extensionsUsed());

        SlaStatus status;
        if (elapsed >= t.breach()) {
            status = SlaStatus.BREACHED;
        } else if (elapsed >= t.critical()) {
            status = SlaStatus.AT_RISK;
        } else if (elapsed >= t.warning()) {
            status = SlaStatus.AT_RISK;
        } else {
            status = progress.extensionsUsed() > 0 ? SlaStatus.EXTENDED : SlaStatus.ON_TIME;
        }

        double remaining      = round(Math.max(0.0, t.target() - elapsed));
        double predictedTotal = predictTotal(elapsed, progress);
        double probability    = breachProbability(elapsed, predictedTotal, t, progress.completed());
        double minutesLeft    = progress.completed() ? 0.0 : Math.max(0.0, predictedTotal - elapsed);
        Instant predictedCompletion = now.plus(Duration.ofSeconds(Math.round(minutesLeft * 60)));

        metrics.slaEvaluated(stage, status, elapsed);
        if (status == SlaStatus.BREACHED) {
            log.warn("SLA breached for {}: elapsed={}m, breach threshold={}m", stage, elapsed, t.breach());
        } else {
            log.debug("SLA {} for {}: elapsed={}m, breachProbability={}", status, stage, elapsed, probability);
        }

        return new SlaResult(stage, status, elapsed, remaining, predictedCompletion,
                probability, progress.extensionsUsed(), t, now);
    }

    // ------------------------------------------------------------------
    // Extensions
    // ------------------------------------------------------------------

    /**
     * Consume one SLA extension for a stage. Re-applying the same
     * {@code extensionId} is a no-op.
     *
     * @return true if the extension was applied now, false if it already had been
     * @throws SlaExtensionRejectedException when extensions are disabled or exhausted
     */
    public boolean extend(StageRecord record, String extensionId) {
        return extend(record, config.current().sla(record.getStage()), extensionId);
    }

    public boolean extend(StageRecord record, SlaConfig sla, String extensionId) {
        if (extensionId == null || extensionId.isBlank()) {
            throw new SlaExtensionRejectedException("An extension id is required");
        }
        if (record.getAppliedExtensionIds().contains(extensionId)) {
            return false;
        }
        if (!sla.extensionsAllowed()) {
            throw new SlaExtensionRejectedException("SLA extensions are not allowed for " + record.getStage());
        }
        if (record.getExtensionsUsed() >= sla.maxExtensions()) {
            throw new SlaExtensionRejectedException("Stage " + record.getStage() + " already used all "
                    + sla.maxExtensions() + " SLA extensions");
        }
        record.applyExtension(extensionId);
        log.info("SLA extension '{}' applied to {} ({}/{}, +{}m)", extensionId, record.getStage(),
                record.getExtensionsUsed(), sla.maxExtensions(), sla.extensionDurationMinutes());
        return true;
    }

    /** True when another extension would still be granted. */
    public boolean canExtend(StageRecord record) {
        SlaConfig sla = config.current().sla(record.getStage());
        return sla.extensionsAllowed() && record.getExtensionsUsed() < sla.maxExtensions();
    }

    public boolean isWithinBusinessHours(Instant now) {
        return new BusinessCalendar(config.current().businessHours()).isWithinBusinessHours(now);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private double elapsedMinutes(SlaConfig sla, Instant startedAt, Instant now) {
        if (!now.isAfter(startedAt)) return 0.0;
        if (sla.businessHoursOnly()) {
            ResilienceConfiguration current = config.current();
            return new BusinessCalendar(current.businessHours()).businessMinutesBetween(startedAt, now);
        }
        return Duration.between(startedAt, now).toMillis() / 60_000.0;
    }

    static double predictTotal(double elapsed, SlaProgress progress) {
        double pct = Math.max(progress.progressPercent(), MIN_PROGRESS);
        double total = elapsed / pct * 100.0;
        return total * (1.0 + ERROR_PENALTY * progress.errorCount());
    }

    static double breachProbability(double elapsed, double predictedTotal,
                                    SlaConfig.Thresholds t, boolean completed) {
        if (completed)                    return 0.0;
        if (elapsed >= t.breach())        return 1.0;
        if (predictedTotal > t.breach())   return 0.8;
        if (predictedTotal > t.critical()) return 0.4;
        if (predictedTotal > t.warning())  return 0.1;
        return 0.05;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
