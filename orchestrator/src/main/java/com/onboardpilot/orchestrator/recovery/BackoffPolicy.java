package com.onboardpilot.orchestrator.recovery;

import com.onboardpilot.orchestrator.model.RecoveryStrategy;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Delay before a retry attempt.
 *
 * <pre>
 *   IMMEDIATE_RETRY            immediate-retry-delay
 *   EXPONENTIAL_BACKOFF_RETRY  min(base-delay × factor^(n−1), max-delay)
 *   anything else              no delay
 * </pre>
 *
 * The exponential curve is Resilience4j's {@link IntervalFunction}; the delay is then handed to
 * {@link RetryScheduler} so that pending retries stay cancellable per session.
 */
public final class BackoffPolicy {

    /** Resilience4j rejects shorter initial intervals. */
    public static final Duration MIN_BASE_DELAY = Duration.ofMillis(10);

    private BackoffPolicy() {}

    /**
     * @param attempt 1-based attempt number within the current recovery
     */
    public static Duration delay(RecoveryStrategy strategy, int attempt, RecoveryConfig config) {
        return switch (strategy) {
            case IMMEDIATE_RETRY -> config.immediateRetryDelay();
            case EXPONENTIAL_BACKOFF_RETRY -> Duration.ofMillis(exponential(config).apply(Math.max(1, attempt)));
            default -> Duration.ZERO;
        };
    }

    private static IntervalFunction exponential(RecoveryConfig config) {
        return IntervalFunction.ofExponentialBackoff(
                config.baseDelay().toMillis(), config.backoffFactor(), config.maxDelay().toMillis());
    }
}
