package com.onboardpilot.orchestrator.sla;

import java.util.List;

/**
 * Timing policy for one stage, bound from {@code onboardpilot.sla.<STAGE>}.
 *
 * Thresholds must satisfy target &lt; warning &lt; critical &lt; breach.
 * That is checked when configuration is loaded, not here, so a monitor can
 * still be asked about an arbitrary policy.
 */
public record SlaConfig(
        int              targetMinutes,
        int              warningMinutes,
        int              criticalMinutes,
        int              breachMinutes,
        boolean          businessHoursOnly,
        List<String>     escalationContacts,
        boolean          extensionsAllowed,
        int              maxExtensions,
        int              extensionDurationMinutes,
        StageCriticality criticality
) {
    public SlaConfig {
        escalationContacts = escalationContacts == null ? List.of() : List.copyOf(escalationContacts);
        criticality        = criticality == null ? StageCriticality.MEDIUM : criticality;
    }

    /** Thresholds shifted by {@code extensions} consumed extensions. */
    public Thresholds effectiveThresholds(int extensions) {
        int shift = Math.max(0, extensions) * extensionDurationMinutes;
        return new Thresholds(
                targetMinutes + shift,
                warningMinutes + shift,
                criticalMinutes + shift,
                breachMinutes + shift);
    }

    public record Thresholds(double target, double warning, double critical, double breach) {}
}
