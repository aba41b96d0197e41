package com.onboardpilot.orchestrator.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onboardpilot.orchestrator.circuit.CircuitBreakerManager;
import com.onboardpilot.orchestrator.circuit.DependencyUnavailableException;
import com.onboardpilot.orchestrator.config.OnboardPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the operations service.
 *
 * <pre>
 *   POST /notifications                  → {"notification_id": "..."}
 *   POST /incidents                      → {"ticket_id": "..."}
 *   POST /dependencies/{service}/restart
 * </pre>
 * Calls go through the {@value OperationsGateway#SERVICE} circuit. A
 * rejected or failed call is logged and reported as empty/false.
 */
@Component
public class HttpOperationsGateway implements OperationsGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpOperationsGateway.class);

    private final JsonHttpClient        http;
    private final CircuitBreakerManager circuits;

    public HttpOperationsGateway(OnboardPilotProperties properties,
                                 ObjectMapper objectMapper,
                                 CircuitBreakerManager circuits) {
        OnboardPilotProperties.Collaborators c = properties.collaborators();
        this.http     = new JsonHttpClient(c.operationsBaseUrl(), c.requestTimeout(), objectMapper);
        this.circuits = circuits;
    }

    @Override
    public Optional<String> notify(NotificationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id",   request.sessionId() == null ? null : request.sessionId().toString());
        body.put("recipients",   request.recipients());
        body.put("level",        request.level().name());
        body.put("message",      request.message());
        body.put("requires_ack", request.requiresAck());
        return call("notify " + request.recipients(), "/notifications", body, "notification_id");
    }

    @Override
    public Optional<String> createIncident(IncidentRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id",  request.sessionId() == null ? null : request.sessionId().toString());
        body.put("stage",       request.stage() == null ? null : request.stage().name());
        body.put("severity",    request.level().name());
        body.put("title",       request.title());
        body.put("description", request.description());
        return call("createIncident", "/incidents", body, "ticket_id");
    }

    @Override
    public boolean restartDependency(String service) {
        try {
            circuits.execute(SERVICE, () ->
                    http.post("/dependencies/" + service + "/restart", Map.of(), "restart " + service));
            log.info("Restart requested for dependency '{}'", service);
            return true;
        } catch (CollaboratorException | DependencyUnavailableException e) {
            log.warn("Restart request for '{}' failed: {}", service, e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Optional<String> call(String opName, String path, Map<String, Object> body, String idField) {
        try {
            JsonNode resp = circuits.execute(SERVICE, () -> http.post(path, body, opName));
            JsonNode id = resp.path(idField);
            if (id.isMissingNode() || id.isNull() || id.asText().isBlank()) {
                log.warn("{} succeeded but the response carried no '{}'", opName, idField);
                return Optional.empty();
            }
            return Optional.of(id.asText());
        } catch (CollaboratorException | DependencyUnavailableException e) {
            log.warn("{} failed: {}", opName, e.getMessage());
            return Optional.empty();
        }
    }
}
