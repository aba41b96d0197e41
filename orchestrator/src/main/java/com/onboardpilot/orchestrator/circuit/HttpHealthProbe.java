package com.onboardpilot.orchestrator.circuit;

import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Probes a dependency by calling its configured health URL.
 * Any 2xx answer is healthy; anything else, including no answer, is not.
 */
@Component
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final ConfigurationRegistry config;
    private final HttpClient            http;

    public HttpHealthProbe(ConfigurationRegistry config) {
        this.config = config;
        this.http   = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(PROBE_TIMEOUT)
                .build();
    }

    @Override
    public boolean isHealthy(String service) {
        MonitoredService target = config.current().circuitBreaker().services().get(service);
        if (target == null || target.healthUrl() == null || target.healthUrl().isBlank()) {
            log.warn("No health URL configured for '{}'; reporting unhealthy", service);
            return false;
        }
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(target.healthUrl()))
                    .timeout(PROBE_TIMEOUT)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<Void> resp = http.send(req, HttpResponse.BodyHandlers.discarding());
            boolean healthy = resp.statusCode() >= 200 && resp.statusCode() < 300;
            if (!healthy) {
                log.debug("Health check for '{}' returned HTTP {}", service, resp.statusCode());
            }
            return healthy;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Health check for '{}' interrupted", service);
            return false;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Health check for '{}' failed: {}", service, e.getMessage());
            return false;
        }
    }
}
