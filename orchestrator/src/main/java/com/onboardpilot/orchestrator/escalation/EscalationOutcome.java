package com.onboardpilot.orchestrator.escalation;

import com.onboardpilot.orchestrator.model.EscalationEvent;

import java.util.List;

/**
 * Events fired by one evaluation.
 *
 * @param pauseRequested a fired rule asked for PAUSE_PIPELINE; the state
 *                       machine applies it, the engine never touches the session
 */
public record EscalationOutcome(List<EscalationEvent> events, boolean pauseRequested) {

    public EscalationOutcome {
        events = List.copyOf(events);
    }

    public static EscalationOutcome none() {
        return new EscalationOutcome(List.of(), false);
    }

    public boolean fired() {
        return !events.isEmpty();
    }
}
