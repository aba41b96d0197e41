package com.onboardpilot.orchestrator.collaborator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.onboardpilot.orchestrator.circuit.CircuitBreakerManager;
import com.onboardpilot.orchestrator.config.OnboardPilotProperties;
import com.onboardpilot.orchestrator.model.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Dispatches stages to the worker gateway over HTTP:
 * {@code POST {worker-base-url}/stages/{stage}/dispatch}.
 *
 * Every call goes through the {@value StageDispatcher#SERVICE} circuit, so
 * an unhealthy gateway fails fast instead of eating retry budget.
 */
@Component
public class HttpStageDispatcher implements StageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(HttpStageDispatcher.class);

    private final JsonHttpClient        http;
    private final CircuitBreakerManager circuits;

    public HttpStageDispatcher(OnboardPilotProperties properties,
                               ObjectMapper objectMapper,
                               CircuitBreakerManager circuits) {
        OnboardPilotProperties.Collaborators c = properties.collaborators();
        this.http     = new JsonHttpClient(c.workerBaseUrl(), c.requestTimeout(), objectMapper);
        this.circuits = circuits;
    }

    @Override
    public void dispatch(UUID sessionId, PipelineStage stage, int attempt) {
        log.info("Dispatching {} for session {} (attempt {})", stage, sessionId, attempt);
        Map<String, Object> body = Map.of(
                "session_id", sessionId.toString(),
                "stage",      stage.name(),
                "attempt",    attempt);
        circuits.run(SERVICE, () ->
                http.post("/stages/" + stage.name() + "/dispatch", body, "dispatch " + stage));
    }
}
