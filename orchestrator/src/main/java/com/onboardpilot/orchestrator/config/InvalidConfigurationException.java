package com.onboardpilot.orchestrator.config;

import java.util.List;

/**
 * Thrown when a configuration fails validation, at startup or on reload.
 * Carries every problem found, not just the first.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> problems;

    public InvalidConfigurationException(List<String> problems) {
        super("Invalid onboarding configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
