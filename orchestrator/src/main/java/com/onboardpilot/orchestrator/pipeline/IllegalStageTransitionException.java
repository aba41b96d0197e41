package com.onboardpilot.orchestrator.pipeline;

/**
 * Thrown when a report or operator action does not fit the stage's current
 * status: a report for a stage that is not current, a different payload for
 * a completed stage, a retry of a stage that has not failed.
 */
public class IllegalStageTransitionException extends RuntimeException {

    public IllegalStageTransitionException(String message) {
        super(message);
    }
}
