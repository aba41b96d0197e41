package com.onboardpilot.orchestrator.config;

import com.onboardpilot.orchestrator.circuit.CircuitBreakerConfig;
import com.onboardpilot.orchestrator.escalation.DynamicEscalationConfig;
import com.onboardpilot.orchestrator.escalation.EscalationRule;
import com.onboardpilot.orchestrator.gate.AuthorizationLevels;
import com.onboardpilot.orchestrator.gate.QualityGateConfig;
import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.recovery.RecoveryConfig;
import com.onboardpilot.orchestrator.sla.BusinessHours;
import com.onboardpilot.orchestrator.sla.SlaConfig;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One complete, versioned set of pipeline and resilience settings.
 *
 * Instances are swapped as a whole by {@link ConfigurationRegistry}; a
 * component that reads {@code current()} once per operation sees a
 * consistent view even while a reload happens.
 */
public record ResilienceConfiguration(
        String                                version,
        List<PipelineStage>                   stages,
        Map<PipelineStage, QualityGateConfig> gates,
        Map<PipelineStage, SlaConfig>         slaConfigs,
        BusinessHours                         businessHours,
        List<EscalationRule>                  rules,
        DynamicEscalationConfig               dynamicEscalation,
        List<String>                          managementRecipients,
        List<String>                          operationsRecipients,
        CircuitBreakerConfig                  circuitBreaker,
        RecoveryConfig                        recovery,
        AuthorizationLevels                   authorization,
        int                                   timeoutGraceMinutes
) {
    public ResilienceConfiguration {
        stages               = stages == null ? List.of() : List.copyOf(stages);
        gates                = gates == null ? Map.of() : copy(gates);
        slaConfigs           = slaConfigs == null ? Map.of() : copy(slaConfigs);
        rules                = rules == null ? List.of() : List.copyOf(rules);
        managementRecipients = managementRecipients == null ? List.of() : List.copyOf(managementRecipients);
        operationsRecipients = operationsRecipients == null ? List.of() : List.copyOf(operationsRecipients);
        dynamicEscalation    = dynamicEscalation == null ? DynamicEscalationConfig.disabled() : dynamicEscalation;
        circuitBreaker       = circuitBreaker == null ? CircuitBreakerConfig.defaults() : circuitBreaker;
        authorization        = authorization == null ? new AuthorizationLevels(Map.of()) : authorization;
        businessHours        = businessHours == null ? new BusinessHours(null, null, null, true) : businessHours;
    }

    public static ResilienceConfiguration from(OnboardPilotProperties p) {
        OnboardPilotProperties.Escalation escalation = p.escalation();
        return new ResilienceConfiguration(
                p.pipeline().configVersion(),
                p.pipeline().stages(),
                p.qualityGates(),
                p.sla(),
                p.businessHours(),
                escalation.rules(),
                escalation.dynamic(),
                escalation.managementRecipients(),
                escalation.operationsRecipients(),
                p.circuitBreaker(),
                p.recovery(),
                new AuthorizationLevels(p.authorizationLevels()),
                p.pipeline().timeoutGraceMinutes());
    }

    // ------------------------------------------------------------------
    // Lookups
    // ------------------------------------------------------------------

    public QualityGateConfig gate(PipelineStage stage) {
        QualityGateConfig gate = gates.get(stage);
        if (gate == null) throw new IllegalArgumentException("No quality gate configured for " + stage);
        return gate;
    }

    public SlaConfig sla(PipelineStage stage) {
        SlaConfig sla = slaConfigs.get(stage);
        if (sla == null) throw new IllegalArgumentException("No SLA configured for " + stage);
        return sla;
    }

    public int stageCount() {
        return stages.size();
    }

    public PipelineStage stageAt(int index) {
        return stages.get(index);
    }

    public int indexOf(PipelineStage stage) {
        return stages.indexOf(stage);
    }

    private static <V> Map<PipelineStage, V> copy(Map<PipelineStage, V> source) {
        return source.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(source));
    }
}
