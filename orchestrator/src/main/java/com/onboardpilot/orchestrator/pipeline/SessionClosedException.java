package com.onboardpilot.orchestrator.pipeline;

import com.onboardpilot.orchestrator.model.SessionState;

import java.util.UUID;

/**
 * Thrown for any write to a session that no longer accepts it: a terminal
 * session, or a paused one for operations that need it running.
 */
public class SessionClosedException extends RuntimeException {

    private final SessionState state;

    public SessionClosedException(UUID sessionId, SessionState state) {
        super("Session " + sessionId + " is " + state);
        this.state = state;
    }

    public SessionState getState() { return state; }
}
