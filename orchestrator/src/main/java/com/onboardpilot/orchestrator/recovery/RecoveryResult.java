package com.onboardpilot.orchestrator.recovery;

import com.onboardpilot.orchestrator.model.PipelineStage;
import com.onboardpilot.orchestrator.model.RecoveryAttempt;
import com.onboardpilot.orchestrator.model.RecoveryStrategy;

import java.util.List;
import java.util.UUID;

/**
 * How a recovery ended.
 *
 * @param cancelled          the session was cancelled, paused or otherwise taken over while recovery was pending
 * @param escalationRequired automatic recovery gave up and a human has been escalated to
 * @param attempts           attempts recorded by this recovery, in order
 */
public record RecoveryResult(
        UUID                  sessionId,
        PipelineStage         stage,
        RecoveryStrategy      strategy,
        RecoveryStatus        status,
        boolean               cancelled,
        boolean               escalationRequired,
        List<RecoveryAttempt> attempts,
        String                message
) {
    public RecoveryResult {
        attempts = List.copyOf(attempts);
    }

    public boolean succeeded() {
        return status == RecoveryStatus.SUCCESS;
    }
}
