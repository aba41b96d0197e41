package com.onboardpilot.orchestrator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background tick that re-evaluates every RUNNING session: SLA status,
 * escalation rules and stage timeouts.
 *
 * Worker outcomes arrive over HTTP, so nothing here waits on a worker. The
 * tick only catches what the passage of time changes.
 */
@Component
@ConditionalOnProperty(name = "onboardpilot.pipeline.monitor-enabled", havingValue = "true", matchIfMissing = true)
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineStateMachine stateMachine;

    public PipelineScheduler(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Scheduled(fixedDelayString = "${onboardpilot.pipeline.monitor-interval-ms:60000}")
    public void tick() {
        int monitored = stateMachine.monitorActiveSessions();
        if (monitored > 0) {
            log.debug("Monitoring pass covered {} running session(s)", monitored);
        }
    }
}
