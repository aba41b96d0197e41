package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.circuit.CircuitSnapshot;
import com.onboardpilot.orchestrator.collaborator.IncidentRequest;
import com.onboardpilot.orchestrator.collaborator.NotificationRequest;
import com.onboardpilot.orchestrator.collaborator.OperationsGateway;
import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.model.EscalationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs the automatic actions of a fired escalation and records each one on
 * the event, successful or not.
 *
 * Entries in {@code actionsExecuted} are the action name, optionally
 * followed by its target, and suffixed with {@code (failed)} when the
 * collaborator refused or could not be reached.
 */
@Component
public class AutomaticActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(AutomaticActionExecutor.class);

    private final OperationsGateway     operations;
    private final ConfigurationRegistry config;

    public AutomaticActionExecutor(OperationsGateway operations, ConfigurationRegistry config) {
        this.operations = operations;
        this.config     = config;
    }

    /**
     * @return true if one of the actions was PAUSE_PIPELINE
     */
    public boolean execute(EscalationEvent event, List<AutomaticAction> actions, List<CircuitSnapshot> circuits) {
        boolean pause = false;
        for (AutomaticAction action : actions) {
            switch (action) {
                case PAUSE_PIPELINE -> {
                    pause = true;
                    event.recordAction(action.name());
                }
                case CREATE_INCIDENT -> createIncident(event);
                case RESTART_DEPENDENCY -> restartOpenDependencies(event, circuits);
                case NOTIFY_MANAGEMENT -> notifyManagement(event);
                case FLAG_FOR_MANUAL_REVIEW -> {
                    event.requireAck();
                    event.recordAction(action.name());
                }
            }
        }
        return pause;
    }

    // ------------------------------------------------------------------
    // Actions
    // ------------------------------------------------------------------

    private void createIncident(EscalationEvent event) {
        String title = event.getLevel() + " escalation " + event.getRuleId()
                + (event.getStage() == null ? "" : " at " + event.getStage());
        Optional<String> ticket = operations.createIncident(new IncidentRequest(
                event.getSessionId(), event.getStage(), event.getLevel(), title, event.getMessage()));
        if (ticket.isPresent()) {
            event.setIncidentTicketId(ticket.get());
            event.recordAction(AutomaticAction.CREATE_INCIDENT.name() + " " + ticket.get());
        } else {
            event.recordAction(AutomaticAction.CREATE_INCIDENT.name() + " (failed)");
        }
    }

    private void restartOpenDependencies(EscalationEvent event, List<CircuitSnapshot> circuits) {
        List<String> open = circuits.stream()
                .filter(CircuitSnapshot::isOpen)
                .map(CircuitSnapshot::serviceName)
                .toList();
        if (open.isEmpty()) {
            log.debug("RESTART_DEPENDENCY for event {}: no open circuits", event.getId());
            event.recordAction(AutomaticAction.RESTART_DEPENDENCY.name() + " (no open circuits)");
            return;
        }
        for (String service : open) {
            boolean accepted = operations.restartDependency(service);
            event.recordAction(AutomaticAction.RESTART_DEPENDENCY.name() + " " + service
                    + (accepted ? "" : " (failed)"));
        }
    }

    private void notifyManagement(EscalationEvent event) {
        List<String> management = config.current().managementRecipients();
        if (management.isEmpty()) {
            log.warn("NOTIFY_MANAGEMENT requested by {} but no management recipients are configured",
                    event.getRuleId());
            event.recordAction(AutomaticAction.NOTIFY_MANAGEMENT.name() + " (failed)");
            return;
        }
        Optional<String> id = operations.notify(new NotificationRequest(
                event.getSessionId(), management, event.getLevel(), event.getMessage(), event.isRequiresAck()));
        event.recordAction(AutomaticAction.NOTIFY_MANAGEMENT.name() + (id.isPresent() ? "" : " (failed)"));
    }
}
