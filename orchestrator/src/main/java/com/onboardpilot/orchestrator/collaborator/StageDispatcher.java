package com.onboardpilot.orchestrator.collaborator;

import com.onboardpilot.orchestrator.model.PipelineStage;

import java.util.UUID;

/**
 * Hands a stage to its worker. The worker answers later through
 * {@code POST /sessions/{id}/stages/{stage}/outcome}.
 */
public interface StageDispatcher {

    /** Circuit-breaker name of the worker gateway. */
    String SERVICE = "worker-gateway";

    /**
     * @param attempt 1 for the first dispatch, incremented on every re-dispatch
     * @throws com.onboardpilot.orchestrator.circuit.DependencyUnavailableException if the worker circuit is open
     * @throws CollaboratorException if the worker gateway rejects or cannot be reached
     */
    void dispatch(UUID sessionId, PipelineStage stage, int attempt);
}
