package com.onboardpilot.orchestrator.circuit;

import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Single source of truth for whether a dependency may be called.
 *
 * One {@link ServiceCircuit} per service name, shared by every session.
 * Callers either report outcomes ({@link #recordOutcome}) or wrap the call
 * itself ({@link #execute}); in both cases the manager, not the caller,
 * decides whether an open circuit means "fail fast".
 *
 * <pre>
 *   CLOSED    --failureThreshold consecutive failures-->  OPEN
 *   OPEN      --recoveryTimeout elapsed----------------->  HALF_OPEN
 *   HALF_OPEN --one failed probe------------------------>  OPEN
 *   HALF_OPEN --successThreshold successful probes------>  CLOSED
 * </pre>
 */
@Component
public class CircuitBreakerManager {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerManager.class);

    private final Map<String, ServiceCircuit> circuits = new ConcurrentHashMap<>();

    private final ConfigurationRegistry config;
    private final PipelineMetrics       metrics;
    private final Clock                 clock;

    public CircuitBreakerManager(ConfigurationRegistry config, PipelineMetrics metrics, Clock clock) {
        this.config  = config;
        this.metrics = metrics;
        this.clock   = clock;
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    /**
     * Feed one health outcome into the service's circuit.
     *
     * While OPEN and still inside the recovery timeout the outcome is
     * ignored: the result is the unchanged circuit with {@code NONE}.
     */
    public CircuitDecision recordOutcome(String service, boolean healthy, Instant now) {
        CircuitDecision decision = circuit(service, now).recordOutcome(healthy, now, settings());
        report(decision);
        return decision;
    }

    public CircuitDecision recordOutcome(String service, boolean healthy) {
        return recordOutcome(service, healthy, clock.instant());
    }

    /** Apply the time-based OPEN → HALF_OPEN transition if it is due. */
    public CircuitDecision evaluate(String service, Instant now) {
        CircuitDecision decision = circuit(service, now).evaluate(now, settings());
        report(decision);
        return decision;
    }

    // ------------------------------------------------------------------
    // Guarded calls
    // ------------------------------------------------------------------

    /**
     * @return true if a call to {@code service} may go ahead now
     */
    public boolean tryAcquire(String service, Instant now) {
        ServiceCircuit.Permission permission = circuit(service, now).tryAcquire(now, settings());
        report(permission.asDecision());
        if (!permission.permitted()) {
            log.debug("Call to '{}' rejected: circuit {}", service, permission.snapshot().state());
        }
        return permission.permitted();
    }

    /**
     * Run {@code call} if the circuit allows it and record the outcome.
     *
     * @throws DependencyUnavailableException when the circuit rejects the call;
     *         {@code call} is not invoked in that case
     */
    public <T> T execute(String service, Supplier<T> call) {
        Instant now = clock.instant();
        if (!tryAcquire(service, now)) {
            throw new DependencyUnavailableException(service, snapshot(service).state());
        }
        try {
            T result = call.get();
            recordOutcome(service, true, clock.instant());
            return result;
        } catch (RuntimeException e) {
            recordOutcome(service, false, clock.instant());
            throw e;
        }
    }

    /** {@link #execute} for calls without a result. */
    public void run(String service, Runnable call) {
        execute(service, () -> {
            call.run();
            return null;
        });
    }

    // ------------------------------------------------------------------
    // Operator actions / reads
    // ------------------------------------------------------------------

    /** Force a circuit closed, clearing its counters. */
    public CircuitSnapshot reset(String service) {
        Instant now = clock.instant();
        CircuitDecision decision = circuit(service, now).reset(now);
        if (decision.transitioned()) {
            log.info("Circuit '{}' reset: {} → CLOSED", service, decision.previousState());
            metrics.circuitTransition(service, CircuitState.CLOSED.name());
        }
        return decision.snapshot();
    }

    /** Lock-free read of the latest published state. Unknown services read as CLOSED. */
    public CircuitSnapshot snapshot(String service) {
        ServiceCircuit circuit = circuits.get(service);
        return circuit != null ? circuit.snapshot() : CircuitSnapshot.closed(service, clock.instant());
    }

    public List<CircuitSnapshot> snapshots() {
        return circuits.values().stream()
                .map(ServiceCircuit::snapshot)
                .sorted(Comparator.comparing(CircuitSnapshot::serviceName))
                .toList();
    }

    /** Services named in configuration, whether or not they have been touched yet. */
    public List<String> monitoredServices() {
        return settings().services().keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ServiceCircuit circuit(String service, Instant now) {
        return circuits.computeIfAbsent(service, name -> new ServiceCircuit(name, now));
    }

    private CircuitBreakerConfig settings() {
        return config.current().circuitBreaker();
    }

    private void report(CircuitDecision decision) {
        if (!decision.transitioned()) return;
        CircuitSnapshot after = decision.snapshot();

        metrics.circuitTransition(after.serviceName(), after.state().name());
        switch (decision.recommendedAction()) {
            case OPEN_CIRCUIT, REOPEN_CIRCUIT ->
                    log.warn("Circuit '{}' {} → OPEN after {} failures ({})", after.serviceName(),
                            decision.previousState(), after.failureCount(), decision.recommendedAction());
            default ->
                    log.info("Circuit '{}' {} → {} ({})", after.serviceName(),
                            decision.previousState(), after.state(), decision.recommendedAction());
        }
    }
}
