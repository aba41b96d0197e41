package com.onboardpilot.orchestrator.sla;

/**
 * What the monitor knows about a stage beyond its start time.
 *
 * @param progressPercent last progress the worker reported, 0..100
 * @param errorCount      errors recorded so far; each one inflates the prediction
 * @param extensionsUsed  SLA extensions already consumed
 * @param completed       a completed stage has nothing left to predict
 */
public record SlaProgress(double progressPercent, int errorCount, int extensionsUsed, boolean completed) {

    public static SlaProgress none() {
        return new SlaProgress(0.0, 0, 0, false);
    }
}
