package com.onboardpilot.orchestrator.config;

import com.onboardpilot.orchestrator.circuit.CircuitBreakerConfig;
import com.onboardpilot.orchestrator.escalation.DynamicEscalationConfig;
import com.onboardpilot.orchestrator.escalation.EscalationRule;
import com.onboardpilot.orchestrator.gate.QualityGateConfig;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.recovery.BackoffPolicy;
import com.onboardpilot.orchestrator.recovery.RecoveryConfig;
import com.onboardpilot.orchestrator.sla.BusinessHours;
import com.onboardpilot.orchestrator.sla.SlaConfig;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a {@link ResilienceConfiguration} against every invariant the
 * engine relies on. Nothing is normalized: a bad value is reported, never
 * quietly corrected.
 */
@Component
public class ResilienceConfigValidator {

    /**
     * @return every problem found; empty when the configuration is usable
     */
    public List<String> validate(ResilienceConfiguration config) {
        List<String> problems = new ArrayList<>();

        if (config.version() == null || config.version().isBlank()) {
            problems.add("pipeline.config-version must not be blank");
        }
        if (config.timeoutGraceMinutes() < 0) {
            problems.add("pipeline.timeout-grace-minutes must not be negative");
        }

        validateStages(config, problems);
        config.gates().forEach((stage, gate) -> validateGate(stage, gate, config, problems));
        config.slaConfigs().forEach((stage, sla) -> validateSla(stage, sla, problems));
        validateRules(config.rules(), problems);
        validateDynamic(config.dynamicEscalation(), problems);
        validateCircuitBreaker(config.circuitBreaker(), problems);
        validateRecovery(config.recovery(), problems);
        validateBusinessHours(config.businessHours(), problems);

        if (config.authorization().asMap().isEmpty()) {
            problems.add("authorization-levels must define at least one level");
        }
        return problems;
    }

    /**
     * @throws InvalidConfigurationException listing every problem
     */
    public void requireValid(ResilienceConfiguration config) {
        List<String> problems = validate(config);
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }
    }

    // ------------------------------------------------------------------
    // Sections
    // ------------------------------------------------------------------

    private void validateStages(ResilienceConfiguration config, List<String> problems) {
        List<PipelineStage> stages = config.stages();
        if (stages.isEmpty()) {
            problems.add("pipeline.stages must list at least one stage");
            return;
        }
        Set<PipelineStage> seen = new HashSet<>();
        for (PipelineStage stage : stages) {
            if (!seen.add(stage)) {
                problems.add("pipeline.stages lists " + stage + " more than once");
            }
            if (!config.gates().containsKey(stage)) {
                problems.add("no quality gate configured for " + stage);
            }
            if (!config.slaConfigs().containsKey(stage)) {
                problems.add("no SLA configured for " + stage);
            }
        }
    }

    private void validateGate(PipelineStage stage, QualityGateConfig gate,
                              ResilienceConfiguration config, List<String> problems) {
        String prefix = "quality gate " + stage + ": ";
        for (String field : gate.requiredFields()) {
            if (field == null || field.isBlank()) {
                problems.add(prefix + "required field names must not be blank");
            }
        }
        for (Map.Entry<String, Double> t : gate.thresholds().entrySet()) {
            if (t.getValue() == null || t.getValue() < 0) {
                problems.add(prefix + "threshold '" + t.getKey() + "' must be a non-negative number");
            }
        }
        if (gate.maxRetries() < 0) {
            problems.add(prefix + "max-retries must not be negative");
        }
        if (gate.bypassable() && !config.authorization().isKnown(gate.bypassAuthLevel())) {
            problems.add(prefix + "bypass-auth-level '" + gate.bypassAuthLevel()
                    + "' is not a known authorization level");
        }
    }

    private void validateSla(PipelineStage stage, SlaConfig sla, List<String> problems) {
        String prefix = "SLA " + stage + ": ";
        if (sla.targetMinutes() <= 0) {
            problems.add(prefix + "target-minutes must be positive");
        }
        if (!(sla.targetMinutes() < sla.warningMinutes()
                && sla.warningMinutes() < sla.criticalMinutes()
                && sla.criticalMinutes() < sla.breachMinutes())) {
            problems.add(prefix + "thresholds must satisfy target < warning < critical < breach (got "
                    + sla.targetMinutes() + "/" + sla.warningMinutes() + "/"
                    + sla.criticalMinutes() + "/" + sla.breachMinutes() + ")");
        }
        if (sla.maxExtensions() < 0) {
            problems.add(prefix + "max-extensions must not be negative");
        }
        if (sla.extensionsAllowed() && (sla.maxExtensions() == 0 || sla.extensionDurationMinutes() <= 0)) {
            problems.add(prefix + "extensions are allowed but max-extensions or extension-duration-minutes is not positive");
        }
    }

    private void validateRules(List<EscalationRule> rules, List<String> problems) {
        Set<String> ids = new HashSet<>();
        for (EscalationRule rule : rules) {
            if (rule.id() == null || rule.id().isBlank()) {
                problems.add("escalation rule without an id");
                continue;
            }
            String prefix = "escalation rule " + rule.id() + ": ";
            if (!ids.add(rule.id())) {
                problems.add(prefix + "duplicate rule id");
            }
            if (rule.level() == null) {
                problems.add(prefix + "level is required");
            }
            if (rule.trigger() == null || rule.trigger().isEmpty()) {
                problems.add(prefix + "trigger must define at least one condition");
            }
            if (rule.recipients().isEmpty()) {
                problems.add(prefix + "must define recipients");
            }
            if (rule.cooldownMinutes() <= 0) {
                problems.add(prefix + "cooldown-minutes must be positive");
            }
            if (rule.maxPerSession() <= 0) {
                problems.add(prefix + "max-per-session must be positive");
            }
        }
    }

    private void validateDynamic(DynamicEscalationConfig dynamic, List<String> problems) {
        if (!dynamic.enabled()) return;
        if (dynamic.minDegradedStages() < 2) {
            problems.add("dynamic escalation: min-degraded-stages must be at least 2");
        }
        if (dynamic.recipients().isEmpty()) {
            problems.add("dynamic escalation: must define recipients");
        }
        if (dynamic.cooldownMinutes() <= 0) {
            problems.add("dynamic escalation: cooldown-minutes must be positive");
        }
        if (dynamic.maxPerSession() <= 0) {
            problems.add("dynamic escalation: max-per-session must be positive");
        }
    }

    private void validateCircuitBreaker(CircuitBreakerConfig cb, List<String> problems) {
        if (cb.failureThreshold() <= 0) {
            problems.add("circuit-breaker.failure-threshold must be positive");
        }
        if (cb.recoveryTimeout().isNegative() || cb.recoveryTimeout().isZero()) {
            problems.add("circuit-breaker.recovery-timeout must be positive");
        }
        if (cb.halfOpenMaxCalls() <= 0) {
            problems.add("circuit-breaker.half-open-max-calls must be positive");
        }
        if (cb.successThreshold() <= 0) {
            problems.add("circuit-breaker.success-threshold must be positive");
        } else if (cb.successThreshold() > cb.halfOpenMaxCalls()) {
            problems.add("circuit-breaker.success-threshold (" + cb.successThreshold()
                    + ") cannot exceed half-open-max-calls (" + cb.halfOpenMaxCalls() + ")");
        }
    }

    private void validateRecovery(RecoveryConfig recovery, List<String> problems) {
        if (recovery == null) {
            problems.add("recovery settings are missing");
            return;
        }
        if (recovery.maxRetryAttempts() <= 0) {
            problems.add("recovery.max-retry-attempts must be positive");
        }
        if (recovery.immediateRetryErrorLimit() < 0) {
            problems.add("recovery.immediate-retry-error-limit must not be negative");
        }
        if (recovery.backoffFactor() < 1.0) {
            problems.add("recovery.backoff-factor must be at least 1.0");
        }
        if (recovery.baseDelay().compareTo(BackoffPolicy.MIN_BASE_DELAY) < 0) {
            problems.add("recovery.base-delay must be at least " + BackoffPolicy.MIN_BASE_DELAY.toMillis() + "ms");
        }
        if (recovery.baseDelay().compareTo(recovery.maxDelay()) > 0) {
            problems.add("recovery.base-delay cannot exceed recovery.max-delay");
        }
        if (recovery.maxWorkflowResumptions() < 0) {
            problems.add("recovery.max-workflow-resumptions must not be negative");
        }
    }

    private void validateBusinessHours(BusinessHours hours, List<String> problems) {
        try {
            hours.zoneId();
            if (!hours.startTime().isBefore(hours.endTime())) {
                problems.add("business-hours.start must be before business-hours.end");
            }
        } catch (DateTimeException e) {
            problems.add("business-hours: " + e.getMessage());
        }
    }
}
