package com.onboardpilot.orchestrator.circuit;

/** A dependency watched by the health-check scheduler. */
public record MonitoredService(String healthUrl) {}
