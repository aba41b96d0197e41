package com.onboardpilot.orchestrator.gate;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of custom rule kinds a gate understands.
 *
 * Kinds are kept as strings in configuration so that a rule written for a
 * newer engine still loads; {@link #parse} returns empty for those and the
 * engine lets them pass.
 */
public enum RuleKind {
    MIN_VALUE,
    MAX_VALUE,
    REQUIRED_BOOLEAN,
    NOT_EMPTY;

    /** Accepts {@code MIN_VALUE}, {@code min_value}, {@code min-value} and {@code minValue}. */
    public static Optional<RuleKind> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String canonical = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        for (RuleKind kind : values()) {
            if (kind.name().equals(canonical)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
