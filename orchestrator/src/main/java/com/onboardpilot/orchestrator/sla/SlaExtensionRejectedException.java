package com.onboardpilot.orchestrator.sla;

/**
 * Thrown when a stage asks for an SLA extension it is not entitled to.
 */
public class SlaExtensionRejectedException extends RuntimeException {

    public SlaExtensionRejectedException(String message) {
        super(message);
    }
}
