package com.onboardpilot.orchestrator.model;

/**
 * The stages an onboarding session can pass through.
 *
 * The order a session actually runs them in comes from
 * {@code onboardpilot.pipeline.stages}; this enum only names them.
 */
public enum PipelineStage {
    DATA_COLLECTION,
    DATA_AGGREGATION,
    IT_PROVISIONING,
    CONTRACT_MANAGEMENT,
    MEETING_COORDINATION
}
