package com.onboardpilot.orchestrator.pipeline;

public class BypassRejectedException extends RuntimeException {

    public BypassRejectedException(String message) {
        super(message);
    }
}
