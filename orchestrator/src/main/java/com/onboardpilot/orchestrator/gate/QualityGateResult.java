package com.onboardpilot.orchestrator.gate;

import com.onboardpilot.orchestrator.model.PipelineStage;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one gate evaluation. Never mutated; a retry produces a new one.
 *
 * When {@code passed} is true, {@code criticalIssues} is always empty. On a
 * bypass the issues that would have failed the gate are carried in
 * {@code warnings}.
 */
public record QualityGateResult(
        PipelineStage        stage,
        GateStatus           status,
        boolean              passed,
        double               score,
        Map<String, Boolean> fieldChecks,
        List<ThresholdCheck> thresholdChecks,
        List<RuleCheck>      ruleChecks,
        List<String>         criticalIssues,
        List<String>         warnings,
        List<String>         recommendations,
        String               bypassReason,
        Instant              evaluatedAt
) {
    public QualityGateResult {
        fieldChecks     = Collections.unmodifiableMap(new LinkedHashMap<>(fieldChecks));
        thresholdChecks = List.copyOf(thresholdChecks);
        ruleChecks      = List.copyOf(ruleChecks);
        criticalIssues  = List.copyOf(criticalIssues);
        warnings        = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }

    /** {@code actual} is null when the metric was not found in the payload. */
    public record ThresholdCheck(String metric, double required, Double actual, boolean passed) {}

    public record RuleCheck(String kind, String field, RuleSeverity severity, boolean passed, String message) {}
}
