package com.onboardpilot.orchestrator.gate;

/** An operator's request to force a failed gate open. */
public record BypassRequest(String authorizationLevel, String reason, String requestedBy) {}
