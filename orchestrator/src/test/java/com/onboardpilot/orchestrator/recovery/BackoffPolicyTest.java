package com.onboardpilot.orchestrator.recovery;

import com.onboardpilot.orchestrator.model.RecoveryStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    private final RecoveryConfig config = new RecoveryConfig(5, 3,
            Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, Duration.ofSeconds(30), 2);

    @Test
    void delay_immediateRetry_usesFixedDelay() {
        assertThat(BackoffPolicy.delay(RecoveryStrategy.IMMEDIATE_RETRY, 4, config))
                .isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void delay_exponential_doublesUntilCapped() {
        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 1, config)).hasSeconds(5);
        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 2, config)).hasSeconds(10);
        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 3, config)).hasSeconds(20);
        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 4, config)).hasSeconds(30);
        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 12, config)).hasSeconds(30);
    }

    @Test
    void delay_exponentialWithAttemptBelowOne_usesBaseDelay() {
        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 0, config)).hasSeconds(5);
    }

    @Test
    void delay_exponentialWithFractionalFactor_growsAndCaps() {
        RecoveryConfig gentle = new RecoveryConfig(5, 3,
                Duration.ofMillis(100), Duration.ofMillis(1000), 1.5, Duration.ofMillis(2000), 2);

        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 2, gentle)).isEqualTo(Duration.ofMillis(1500));
        assertThat(BackoffPolicy.delay(RecoveryStrategy.EXPONENTIAL_BACKOFF_RETRY, 3, gentle)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void delay_nonRetryStrategies_haveNoDelay() {
        assertThat(BackoffPolicy.delay(RecoveryStrategy.STATE_RESTORATION, 1, config)).isZero();
        assertThat(BackoffPolicy.delay(RecoveryStrategy.ESCALATE_TO_HUMAN, 1, config)).isZero();
    }
}
