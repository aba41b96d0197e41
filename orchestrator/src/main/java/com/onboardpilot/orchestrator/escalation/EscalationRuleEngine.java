package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.circuit.CircuitSnapshot;
import com.onboardpilot.orchestrator.collaborator.NotificationRequest;
import com.onboardpilot.orchestrator.collaborator.OperationsGateway;
import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.config.ResilienceConfiguration;
import com.onboardpilot.orchestrator.metrics.PipelineMetrics;
import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.registry.StageRegistry;
import com.onboardpilot.orchestrator.sla.SlaResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns quality, SLA and circuit signals into escalation events.
 *
 * Three sources of events:
 * <ul>
 *   <li>the static rule table ({@link #evaluate}), rate-limited per
 *       (session, rule) by {@link CooldownTracker};</li>
 *   <li>dynamic compound-degradation escalation, fired when enough stages are
 *       degraded at once, with its own cooldown key;</li>
 *   <li>direct escalations raised by the pipeline ({@link #escalateDirect}).</li>
 * </ul>
 * Every fired event is notified, has its automatic actions run, and is
 * persisted. Notification failures are recorded on the event and never
 * stop the pipeline.
 */
@Component
public class EscalationRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(EscalationRuleEngine.class);

    static final String DYNAMIC_RULE_ID = "dynamic_compound_degradation";

    private final ConfigurationRegistry   config;
    private final CooldownTracker         cooldowns;
    private final OperationsGateway       operations;
    private final AutomaticActionExecutor actions;
    private final StageRegistry           registry;
    private final PipelineMetrics         metrics;
    private final Clock                   clock;

    public EscalationRuleEngine(ConfigurationRegistry config,
                                CooldownTracker cooldowns,
                                OperationsGateway operations,
                                AutomaticActionExecutor actions,
                                StageRegistry registry,
                                PipelineMetrics metrics,
                                Clock clock) {
        this.config     = config;
        this.cooldowns  = cooldowns;
        this.operations = operations;
        this.actions    = actions;
        this.registry   = registry;
        this.metrics    = metrics;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Rule table
    // ------------------------------------------------------------------

    /**
     * Match every configured rule against {@code signals} and fire those that
     * match and are outside their cooldown.
     */
    public EscalationOutcome evaluate(EscalationSignals signals, Instant now) {
        ResilienceConfiguration current = config.current();
        List<EscalationEvent> fired = new ArrayList<>();
        boolean pause = false;

        for (EscalationRule rule : current.rules()) {
            Optional<TriggerMatch> match = TriggerMatch.of(rule.trigger(), signals);
            if (match.isEmpty()) continue;

            if (!cooldowns.tryFire(signals.sessionId(), rule.id(),
                    Duration.ofMinutes(rule.cooldownMinutes()), rule.maxPerSession(), now)) {
                log.debug("Rule {} matched for session {} but is cooling down or exhausted",
                        rule.id(), signals.sessionId());
                continue;
            }

            TriggerMatch m = match.get();
            String message = render(rule.messageTemplate(), signals, m, rule.name());
            EscalationEvent event = new EscalationEvent(signals.sessionId(), rule.id(), rule.level(),
                    m.stage(), m.reason(), message, rule.recipients(), rule.requiresAck(), false, now);
            pause |= fire(event, rule.automaticActions(), signals.circuits());
            fired.add(event);
        }

        dynamicEscalation(current, signals, now).ifPresent(fired::add);
        return new EscalationOutcome(fired, pause);
    }

    // ------------------------------------------------------------------
    // Direct escalation
    // ------------------------------------------------------------------

    /**
     * Raise an escalation without consulting the rule table. Recipients are the
     * stage's SLA contacts plus operations, and management for EMERGENCY.
     */
    public EscalationEvent escalateDirect(DirectEscalation request) {
        ResilienceConfiguration current = config.current();
        Set<String> recipients = new LinkedHashSet<>();
        if (request.stage() != null && current.slaConfigs().containsKey(request.stage())) {
            recipients.addAll(current.sla(request.stage()).escalationContacts());
        }
        recipients.addAll(current.operationsRecipients());
        if (request.level() == EscalationLevel.EMERGENCY) {
            recipients.addAll(current.managementRecipients());
        }

        String stageName = request.stage() == null ? "session" : request.stage().name();
        String message = "[" + request.level() + "] " + request.type() + " for " + request.subjectId()
                + " at " + stageName + ": " + request.reason();
        EscalationEvent event = new EscalationEvent(request.sessionId(), request.ruleId(), request.level(),
                request.stage(), request.reason(), message, List.copyOf(recipients),
                request.requiresAck(), false, clock.instant());
        fire(event, List.of(), List.of());
        return event;
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    /** Acknowledge an event. Acknowledging twice keeps the first acknowledgement. */
    public EscalationEvent acknowledge(UUID eventId, String operator) {
        EscalationEvent event = registry.findEscalation(eventId)
                .orElseThrow(() -> new EscalationNotFoundException(eventId));
        if (event.isAcknowledged()) {
            return event;
        }
        event.acknowledge(operator, clock.instant());
        log.info("Escalation {} ({}) acknowledged by {}", eventId, event.getRuleId(), operator);
        return registry.saveEscalation(event);
    }

    /**
     * @throws EscalationAlreadyResolvedException if the event is already resolved
     */
    public EscalationEvent resolve(UUID eventId, String operator, String notes) {
        EscalationEvent event = registry.findEscalation(eventId)
                .orElseThrow(() -> new EscalationNotFoundException(eventId));
        if (event.isResolved()) {
            throw new EscalationAlreadyResolvedException(eventId, event.getResolvedBy());
        }
        event.resolve(operator, notes, clock.instant());
        log.info("Escalation {} ({}) resolved by {}", eventId, event.getRuleId(), operator);
        return registry.saveEscalation(event);
    }

    /** Drop cooldown state of a session that reached a terminal state. */
    public void forgetSession(UUID sessionId) {
        cooldowns.clear(sessionId);
    }

    // ------------------------------------------------------------------
    // Firing
    // ------------------------------------------------------------------

    /** Notify, run actions, persist. Returns whether a pause was requested. */
    private boolean fire(EscalationEvent event, List<AutomaticAction> automaticActions,
                         List<CircuitSnapshot> circuits) {
        if (event.getRecipients().isEmpty()) {
            log.warn("Escalation {} has no recipients; notification skipped", event.getRuleId());
        } else {
            Optional<String> notificationId = operations.notify(new NotificationRequest(
                    event.getSessionId(), event.getRecipients(), event.getLevel(),
                    event.getMessage(), event.isRequiresAck()));
            event.recordDelivery(notificationId.orElse(null));
        }

        boolean pause = actions.execute(event, automaticActions, circuits);
        registry.saveEscalation(event);
        metrics.escalationFired(event.getRuleId(), event.getLevel());

        log.warn("Escalation {} fired for session {} at {} ({}): {}{}",
                event.getRuleId(), event.getSessionId(),
                event.getStage() == null ? "session" : event.getStage(),
                event.getLevel(), event.getTriggerReason(),
                event.isNotificationDelivered() ? "" : " [notification not delivered]");
        return pause;
    }

    private Optional<EscalationEvent> dynamicEscalation(ResilienceConfiguration current,
                                                        EscalationSignals signals, Instant now) {
        DynamicEscalationConfig dynamic = current.dynamicEscalation();
        if (!dynamic.enabled()) return Optional.empty();

        List<StageSignal> degraded = signals.stages().stream().filter(StageSignal::isSlaDegraded).toList();
        if (degraded.size() < dynamic.minDegradedStages()) return Optional.empty();

        if (!cooldowns.tryFire(signals.sessionId(), DYNAMIC_RULE_ID,
                Duration.ofMinutes(dynamic.cooldownMinutes()), dynamic.maxPerSession(), now)) {
            return Optional.empty();
        }

        String reason = degraded.size() + " stages degraded at once: " + degraded.stream()
                .map(s -> s.stage() + "=" + s.activeSla().status())
                .toList();
        String message = "[" + dynamic.level() + "] Compound degradation for " + signals.subjectId()
                + " (session " + signals.sessionId() + "): " + reason;
        EscalationEvent event = new EscalationEvent(signals.sessionId(), DYNAMIC_RULE_ID, dynamic.level(),
                null, reason, message, dynamic.recipients(), false, true, now);
        fire(event, List.of(), signals.circuits());
        return Optional.of(event);
    }

    // ------------------------------------------------------------------
    // Message templates
    // ------------------------------------------------------------------

    static String render(String template, EscalationSignals signals, TriggerMatch match, String ruleName) {
        if (template == null || template.isBlank()) {
            return ruleName + ": " + match.reason();
        }
        StageSignal stage = match.stageSignal();
        Map<String, String> values = new LinkedHashMap<>();
        values.put("{subject_id}",     String.valueOf(signals.subjectId()));
        values.put("{session_id}",     String.valueOf(signals.sessionId()));
        values.put("{stage}",          stage == null ? "session" : stage.stage().name());
        values.put("{breach_minutes}", stage == null || stage.activeSla() == null
                                         ? "0" : format(stage.activeSla().minutesPastBreach()));
        values.put("{error_count}",    stage == null ? "0" : String.valueOf(stage.errorCount()));
        values.put("{stages_at_risk}", String.valueOf(signals.stagesAtRisk()));
        values.put("{reason}",         match.reason());

        String out = template;
        for (Map.Entry<String, String> e : values.entrySet()) {
            out = out.replace(e.getKey(), e.getValue());
        }
        return out;
    }

    private static String format(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    // ------------------------------------------------------------------
    // Trigger matching
    // ------------------------------------------------------------------

    /**
     * A successful match: the stage that satisfied the stage conditions (null
     * for session-only rules) and a readable reason.
     */
    record TriggerMatch(StageSignal stageSignal, String reason) {

        PipelineStage stage() {
            return stageSignal == null ? null : stageSignal.stage();
        }

        static Optional<TriggerMatch> of(TriggerConditions t, EscalationSignals signals) {
            if (t == null || t.isEmpty()) return Optional.empty();

            List<String> reasons = new ArrayList<>();
            StageSignal matchedStage = null;

            if (t.hasStageConditions()) {
                Optional<StageSignal> hit = signals.stages().stream()
                        .filter(s -> stageMatches(t, s))
                        .findFirst();
                if (hit.isEmpty()) return Optional.empty();
                matchedStage = hit.get();
                reasons.add(describeStage(t, matchedStage));
            }

            if (t.minStagesAtRisk() != null) {
                long atRisk = signals.stagesAtRisk();
                if (atRisk < t.minStagesAtRisk()) return Optional.empty();
                reasons.add(atRisk + " stages at risk");
            }
            if (t.circuitState() != null) {
                List<String> services = signals.circuits().stream()
                        .filter(c -> c.state() == t.circuitState())
                        .map(CircuitSnapshot::serviceName)
                        .toList();
                if (services.isEmpty()) return Optional.empty();
                reasons.add("circuit " + t.circuitState() + " for " + String.join(", ", services));
            }
            if (t.outsideBusinessHours() != null) {
                if (signals.outsideBusinessHours() != t.outsideBusinessHours()) return Optional.empty();
                reasons.add(signals.outsideBusinessHours() ? "outside business hours" : "within business hours");
            }
            return Optional.of(new TriggerMatch(matchedStage, String.join("; ", reasons)));
        }

        private static boolean stageMatches(TriggerConditions t, StageSignal s) {
            SlaResult sla = s.activeSla();
            if (t.slaStatus() != null && (sla == null || sla.status() != t.slaStatus())) return false;
            if (t.stageCriticality() != null && s.criticality() != t.stageCriticality()) return false;
            if (t.minBreachMinutes() != null
                    && (sla == null || sla.minutesPastBreach() < t.minBreachMinutes())) return false;
            if (t.gateStatus() != null && s.gateStatus() != t.gateStatus()) return false;
            if (t.minRetryAttempts() != null && s.retryCount() < t.minRetryAttempts()) return false;
            if (t.stageStatus() != null && s.status() != t.stageStatus()) return false;
            if (t.minErrorCount() != null && s.errorCount() < t.minErrorCount()) return false;
            return true;
        }

        private static String describeStage(TriggerConditions t, StageSignal s) {
            List<String> parts = new ArrayList<>();
            if (t.slaStatus() != null)        parts.add("SLA " + s.activeSla().status());
            if (t.stageCriticality() != null) parts.add("criticality " + s.criticality());
            if (t.minBreachMinutes() != null) parts.add(format(s.activeSla().minutesPastBreach()) + " min past breach");
            if (t.gateStatus() != null)       parts.add("gate " + s.gateStatus());
            if (t.minRetryAttempts() != null) parts.add(s.retryCount() + " retries");
            if (t.stageStatus() != null)      parts.add("status " + s.status());
            if (t.minErrorCount() != null)    parts.add(s.errorCount() + " errors");
            return s.stage() + ": " + String.join(", ", parts);
        }
    }
}
