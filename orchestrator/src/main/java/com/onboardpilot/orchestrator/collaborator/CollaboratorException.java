package com.onboardpilot.orchestrator.collaborator;

/**
 * Thrown when a worker or operations service returns an error or is unreachable.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
