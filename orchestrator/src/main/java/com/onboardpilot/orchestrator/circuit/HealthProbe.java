package com.onboardpilot.orchestrator.circuit;

/**
 * Checks whether a dependency is healthy right now.
 *
 * Production uses {@link HttpHealthProbe}; tests supply scripted outcomes.
 * Implementations report problems as {@code false} rather than throwing.
 */
public interface HealthProbe {

    boolean isHealthy(String service);
}
