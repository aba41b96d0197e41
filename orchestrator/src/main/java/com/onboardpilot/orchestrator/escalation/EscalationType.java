package com.onboardpilot.orchestrator.escalation;

public enum EscalationType {
    SLA_BREACH,
    QUALITY_FAILURE,
    STAGE_FAILURE,
    DEPENDENCY_FAILURE,
    COMPOUND_DEGRADATION,
    BUSINESS_HOURS,
    MANUAL_INTERVENTION
}
