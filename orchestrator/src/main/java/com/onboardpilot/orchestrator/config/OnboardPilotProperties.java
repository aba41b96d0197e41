package com.onboardpilot.orchestrator.config;

import com.onboardpilot.orchestrator.circuit.CircuitBreakerConfig;
import com.onboardpilot.orchestrator.escalation.DynamicEscalationConfig;
import com.onboardpilot.orchestrator.escalation.EscalationRule;
import com.onboardpilot.orchestrator.gate.QualityGateConfig;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.recovery.RecoveryConfig;
import com.onboardpilot.orchestrator.sla.BusinessHours;
import com.onboardpilot.orchestrator.sla.SlaConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code onboardpilot.*} in application.yml.
 *
 * Bound once at startup into immutable records. Nothing here is validated;
 * {@link ConfigurationRegistry} turns it into a {@link ResilienceConfiguration}
 * and refuses to start if that fails {@link ResilienceConfigValidator}.
 */
@ConfigurationProperties(prefix = "onboardpilot")
public record OnboardPilotProperties(
        @DefaultValue Pipeline                pipeline,
        Map<PipelineStage, QualityGateConfig> qualityGates,
        Map<PipelineStage, SlaConfig>         sla,
        @DefaultValue BusinessHours           businessHours,
        @DefaultValue Escalation              escalation,
        CircuitBreakerConfig                  circuitBreaker,
        RecoveryConfig                        recovery,
        Map<String, Integer>                  authorizationLevels,
        @DefaultValue Collaborators           collaborators
) {

    public record Pipeline(
            List<PipelineStage> stages,
            @DefaultValue("unversioned") String configVersion,
            @DefaultValue("10") int timeoutGraceMinutes
    ) {}

    public record Escalation(
            List<EscalationRule>    rules,
            DynamicEscalationConfig dynamic,
            List<String>            managementRecipients,
            List<String>            operationsRecipients
    ) {}

    /** Where the external worker and operations services live. */
    public record Collaborators(
            @DefaultValue("http://localhost:8090") String   workerBaseUrl,
            @DefaultValue("http://localhost:8091") String   operationsBaseUrl,
            @DefaultValue("10s")                   Duration requestTimeout
    ) {}
}
