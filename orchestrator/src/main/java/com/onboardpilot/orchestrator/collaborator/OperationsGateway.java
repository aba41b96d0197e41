package com.onboardpilot.orchestrator.collaborator;

import java.util.Optional;

/**
 * Notification, ticketing and restart requests towards the operations side.
 *
 * Every method is fire-and-forget from the pipeline's point of view:
 * failures are reported through the return value and never thrown.
 */
public interface OperationsGateway {

    /** Circuit-breaker name of the operations gateway. */
    String SERVICE = "operations-gateway";

    /** @return the notification id, or empty if delivery failed */
    Optional<String> notify(NotificationRequest request);

    /** @return the ticket id, or empty if no incident could be opened */
    Optional<String> createIncident(IncidentRequest request);

    /** @return true if operations accepted the restart request */
    boolean restartDependency(String service);
}
