package com.onboardpilot.orchestrator.gate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static quality gate configuration for one stage, bound from
 * {@code onboardpilot.quality-gates.<STAGE>}.
 *
 * Threshold order is kept as configured so that failure messages come out
 * in a stable order.
 */
public record QualityGateConfig(
        List<String>         requiredFields,
        Map<String, Double>  thresholds,
        List<ValidationRule> rules,
        boolean              mandatory,
        boolean              bypassable,
        String               bypassAuthLevel,
        FailureAction        failureAction,
        int                  maxRetries
) {
    public QualityGateConfig {
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        thresholds     = thresholds == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
        rules          = rules == null ? List.of() : List.copyOf(rules);
        failureAction  = failureAction == null ? FailureAction.BLOCK : failureAction;
    }

    /** A mandatory gate that blocks on failure never falls back to manual review. */
    public boolean isHardBlock() {
        return mandatory && failureAction == FailureAction.BLOCK;
    }
}
