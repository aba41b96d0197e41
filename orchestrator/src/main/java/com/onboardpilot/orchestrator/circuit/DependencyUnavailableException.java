package com.onboardpilot.orchestrator.circuit;

/**
 * Thrown instead of calling a dependency whose circuit does not permit calls.
 */
public class DependencyUnavailableException extends RuntimeException {

    private final String service;

    public DependencyUnavailableException(String service, CircuitState state) {
        super("Dependency '" + service + "' is unavailable (circuit " + state + ")");
        this.service = service;
    }

    public String getService() { return service; }
}
