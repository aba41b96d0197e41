package com.onboardpilot.orchestrator.metrics;

import com.onboardpilot.orchestrator.gate.GateStatus;
import com.onboardpilot.orchestrator.model.*;
import com.onboardpilot.orchestrator.sla.SlaStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide metrics for the pipeline, injected into every component that
 * reports something.
 *
 * Everything lands in Micrometer:
 * <pre>
 *   onboardpilot.sessions.active                       (gauge)
 *   onboardpilot.sessions.terminated{state}
 *   onboardpilot.stage.transitions{stage, status}
 *   onboardpilot.gate.evaluations{stage, status}
 *   onboardpilot.sla.evaluations{stage, status}
 *   onboardpilot.sla.elapsed.minutes{stage}            (distribution)
 *   onboardpilot.circuit.transitions{service, state}
 *   onboardpilot.escalations.fired{rule, level}
 *   onboardpilot.recovery.attempts{action, status}
 *   onboardpilot.recovery.duration{strategy, status}   (timer)
 * </pre>
 * SLA results themselves are not stored historically; the per-stage
 * counters below are the only history kept.
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry registry;
    private final AtomicLong    activeSessions = new AtomicLong();

    private final Map<PipelineStage, SlaTally> slaTallies = new EnumMap<>(PipelineStage.class);

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (PipelineStage stage : PipelineStage.values()) {
            slaTallies.put(stage, new SlaTally());
        }
        Gauge.builder("onboardpilot.sessions.active", activeSessions, AtomicLong::get)
                .description("Sessions that have started and not reached a terminal state")
                .register(registry);
    }

    // ------------------------------------------------------------------
    // Sessions and stages
    // ------------------------------------------------------------------

    public void sessionStarted() {
        activeSessions.incrementAndGet();
    }

    public void sessionTerminated(SessionState state) {
        activeSessions.updateAndGet(n -> Math.max(0, n - 1));
        Counter.builder("onboardpilot.sessions.terminated")
                .tag("state", state.name())
                .register(registry)
                .increment();
    }

    public long activeSessions() {
        return activeSessions.get();
    }

    public void stageTransition(PipelineStage stage, StageStatus status) {
        Counter.builder("onboardpilot.stage.transitions")
                .tag("stage", stage.name())
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    // ------------------------------------------------------------------
    // Gate / SLA
    // ------------------------------------------------------------------

    public void gateEvaluated(PipelineStage stage, GateStatus status) {
        Counter.builder("onboardpilot.gate.evaluations")
                .tag("stage", stage.name())
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void slaEvaluated(PipelineStage stage, SlaStatus status, double elapsedMinutes) {
        Counter.builder("onboardpilot.sla.evaluations")
                .tag("stage", stage.name())
                .tag("status", status.name())
                .register(registry)
                .increment();
        DistributionSummary.builder("onboardpilot.sla.elapsed.minutes")
                .tag("stage", stage.name())
                .register(registry)
                .record(elapsedMinutes);
        slaTallies.get(stage).record(status);
    }

    /** Aggregated SLA history for one stage since process start. */
    public SlaTally.View slaTally(PipelineStage stage) {
        return slaTallies.get(stage).view();
    }

    // ------------------------------------------------------------------
    // Circuits / escalation / recovery
    // ------------------------------------------------------------------

    public void circuitTransition(String service, String state) {
        Counter.builder("onboardpilot.circuit.transitions")
                .tag("service", service)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void escalationFired(String ruleId, EscalationLevel level) {
        Counter.builder("onboardpilot.escalations.fired")
                .tag("rule", ruleId)
                .tag("level", level.name())
                .register(registry)
                .increment();
    }

    public void recoveryAttempt(RecoveryAction action, AttemptStatus status) {
        Counter.builder("onboardpilot.recovery.attempts")
                .tag("action", action.name())
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recoveryFinished(RecoveryStrategy strategy, String status, Duration duration) {
        Timer.builder("onboardpilot.recovery.duration")
                .tag("strategy", strategy.name())
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    // ------------------------------------------------------------------
    // SLA tally
    // ------------------------------------------------------------------

    /** Lock-free running counts of SLA classifications for one stage. */
    public static final class SlaTally {

        private final AtomicLong onTime   = new AtomicLong();
        private final AtomicLong atRisk   = new AtomicLong();
        private final AtomicLong breached = new AtomicLong();
        private final AtomicLong extended = new AtomicLong();

        void record(SlaStatus status) {
            switch (status) {
                case ON_TIME  -> onTime.incrementAndGet();
                case AT_RISK  -> atRisk.incrementAndGet();
                case BREACHED -> breached.incrementAndGet();
                case EXTENDED -> extended.incrementAndGet();
            }
        }

        View view() {
            return new View(onTime.get(), atRisk.get(), breached.get(), extended.get());
        }

        public record View(long onTime, long atRisk, long breached, long extended) {
            public long total() { return onTime + atRisk + breached + extended; }
        }
    }
}
