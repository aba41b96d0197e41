package com.onboardpilot.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infrastructure beans shared by the pipeline components.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(OnboardPilotProperties.class)
public class OrchestratorConfiguration {

    // Timer threads for retry delays.
    private static final int RETRY_TIMER_THREADS = 2;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs recovery retry delays. Timers are cancelled per session, never slept on. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService recoveryTimers() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(RETRY_TIMER_THREADS, r -> {
            Thread t = new Thread(r, "recovery-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
