package com.onboardpilot.orchestrator.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodically probes every configured dependency and feeds the result into
 * its circuit. This is what moves an idle OPEN circuit towards HALF_OPEN and,
 * with healthy probes, back to CLOSED.
 */
@Component
@ConditionalOnProperty(name = "onboardpilot.circuit-breaker.health-checks-enabled",
        havingValue = "true", matchIfMissing = true)
public class HealthCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckScheduler.class);

    private final CircuitBreakerManager circuits;
    private final HealthProbe           probe;
    private final Clock                 clock;

    public HealthCheckScheduler(CircuitBreakerManager circuits, HealthProbe probe, Clock clock) {
        this.circuits = circuits;
        this.probe    = probe;
        this.clock    = clock;
    }

    @Scheduled(fixedDelayString = "${onboardpilot.circuit-breaker.probe-interval-ms:30000}")
    public void probeAll() {
        for (String service : circuits.monitoredServices()) {
            probe(service);
        }
    }

    /**
     * Probe one service. An OPEN circuit still inside its recovery timeout
     * is left alone so the probe cannot count as a premature HALF_OPEN call.
     */
    public CircuitDecision probe(String service) {
        CircuitDecision timed = circuits.evaluate(service, clock.instant());
        if (timed.state() == CircuitState.OPEN) {
            return timed;
        }
        boolean healthy = probe.isHealthy(service);
        CircuitDecision decision = circuits.recordOutcome(service, healthy, clock.instant());
        if (!healthy) {
            log.debug("Health probe for '{}' failed; circuit now {}", service, decision.state());
        }
        return decision;
    }
}
