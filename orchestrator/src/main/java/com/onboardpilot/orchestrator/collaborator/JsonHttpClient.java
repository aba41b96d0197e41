package com.onboardpilot.orchestrator.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal JSON-over-HTTP transport shared by the collaborator clients.
 * Every failure surfaces as a {@link CollaboratorException}.
 */
class JsonHttpClient {

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    JsonHttpClient(String baseUrl, Duration timeout, ObjectMapper json) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = json;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
    }

    /** POST {@code body} as JSON; returns the parsed response (empty object for an empty body). */
    JsonNode post(String path, Object body, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new CollaboratorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            String text = resp.body();
            return text == null || text.isBlank() ? json.createObjectNode() : json.readTree(text);
        } catch (CollaboratorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new CollaboratorException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("JSON serialization failed", e);
        }
    }
}
