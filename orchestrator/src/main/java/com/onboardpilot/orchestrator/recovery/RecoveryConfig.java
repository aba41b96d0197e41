package com.onboardpilot.orchestrator.recovery;

import java.time.Duration;

/**
 * Recovery budget and retry pacing.
 *
 * @param maxRetryAttempts          attempts per stage before the session needs a human
 * @param immediateRetryErrorLimit  transient failures below this error count retry immediately
 * @param immediateRetryDelay       pause before an immediate retry
 * @param baseDelay                 first exponential backoff delay
 * @param backoffFactor             multiplier between backoff delays
 * @param maxDelay                  cap on any single backoff delay
 * @param maxWorkflowResumptions    how often a session may be resumed from its last completed stage
 */
public record RecoveryConfig(
        int      maxRetryAttempts,
        int      immediateRetryErrorLimit,
        Duration immediateRetryDelay,
        Duration baseDelay,
        double   backoffFactor,
        Duration maxDelay,
        int      maxWorkflowResumptions
) {
    public RecoveryConfig {
        immediateRetryDelay = immediateRetryDelay == null ? Duration.ofMillis(100) : immediateRetryDelay;
        baseDelay           = baseDelay == null ? Duration.ofSeconds(5) : baseDelay;
        maxDelay            = maxDelay == null ? Duration.ofSeconds(300) : maxDelay;
    }
}
