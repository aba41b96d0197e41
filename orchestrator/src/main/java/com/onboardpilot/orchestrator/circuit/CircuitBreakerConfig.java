package com.onboardpilot.orchestrator.circuit;

import java.time.Duration;
import java.util.Map;

/**
 * Breaker parameters shared by every monitored dependency.
 */
public record CircuitBreakerConfig(
        int                           failureThreshold,
        Duration                      recoveryTimeout,
        int                           halfOpenMaxCalls,
        int                           successThreshold,
        Map<String, MonitoredService> services
) {
    public CircuitBreakerConfig {
        recoveryTimeout = recoveryTimeout == null ? Duration.ofSeconds(60) : recoveryTimeout;
        services        = services == null ? Map.of() : Map.copyOf(services);
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60), 3, 2, Map.of());
    }
}
