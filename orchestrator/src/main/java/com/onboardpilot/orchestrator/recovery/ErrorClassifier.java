package com.onboardpilot.orchestrator.recovery;

import com.onboardpilot.orchestrator.model.StageError;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Maps worker error codes to a {@link FailureKind}. Unknown codes are
 * treated as transient.
 */
@Component
public class ErrorClassifier {

    private static final Map<String, FailureKind> CODES = Map.ofEntries(
            Map.entry("TIMEOUT",                FailureKind.TRANSIENT),
            Map.entry("CONNECTION_ERROR",       FailureKind.TRANSIENT),
            Map.entry("NETWORK",                FailureKind.TRANSIENT),
            Map.entry("RATE_LIMITED",           FailureKind.RESOURCE_EXHAUSTION),
            Map.entry("RESOURCE_EXHAUSTED",     FailureKind.RESOURCE_EXHAUSTION),
            Map.entry("QUOTA_EXCEEDED",         FailureKind.RESOURCE_EXHAUSTION),
            Map.entry("DEPENDENCY_UNAVAILABLE", FailureKind.DEPENDENCY_UNAVAILABLE),
            Map.entry("SERVICE_UNAVAILABLE",    FailureKind.DEPENDENCY_UNAVAILABLE),
            Map.entry("INCONSISTENT_STATE",     FailureKind.STATE_INCONSISTENCY),
            Map.entry("CORRUPT_OUTPUT",         FailureKind.STATE_INCONSISTENCY),
            Map.entry("VALIDATION_ERROR",       FailureKind.STATE_INCONSISTENCY),
            Map.entry("FATAL",                  FailureKind.UNRECOVERABLE),
            Map.entry("PERMISSION_DENIED",      FailureKind.UNRECOVERABLE));

    public FailureKind classify(String code) {
        return code == null ? FailureKind.TRANSIENT : CODES.getOrDefault(code, FailureKind.TRANSIENT);
    }

    /** Most severe kind among {@code errors}; TRANSIENT for an empty list. */
    public FailureKind classify(List<StageError> errors) {
        FailureKind kind = FailureKind.TRANSIENT;
        for (StageError error : errors) {
            kind = kind.mostSevere(classify(error.code()));
        }
        return kind;
    }
}
