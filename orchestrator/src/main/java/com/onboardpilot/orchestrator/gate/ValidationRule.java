package com.onboardpilot.orchestrator.gate;

/**
 * One custom rule attached to a quality gate.
 *
 * Only the fields relevant to the rule's kind are read: {@code minValue}
 * for MIN_VALUE, {@code maxValue} for MAX_VALUE, {@code expected} for
 * REQUIRED_BOOLEAN. NOT_EMPTY needs just the field.
 */
public record ValidationRule(
        String       kind,
        String       field,
        Double       minValue,
        Double       maxValue,
        Boolean      expected,
        RuleSeverity severity,
        String       description
) {
    public ValidationRule {
        if (severity == null) severity = RuleSeverity.WARNING;
        if (description == null) description = "";
    }

    public static ValidationRule minValue(String field, double min) {
        return new ValidationRule(RuleKind.MIN_VALUE.name(), field, min, null, null, RuleSeverity.ERROR, "");
    }

    public static ValidationRule requiredBoolean(String field, boolean expected) {
        return new ValidationRule(RuleKind.REQUIRED_BOOLEAN.name(), field, null, null, expected, RuleSeverity.ERROR, "");
    }
}
