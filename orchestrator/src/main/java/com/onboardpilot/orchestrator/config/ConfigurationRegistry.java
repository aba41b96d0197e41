package com.onboardpilot.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link ResilienceConfiguration}.
 *
 * The startup configuration is validated before the application context
 * finishes, so an invalid application.yml stops the process. {@link #reload}
 * validates the candidate first and only then swaps it in; a rejected
 * candidate leaves the active configuration untouched.
 */
@Component
public class ConfigurationRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationRegistry.class);

    private final ResilienceConfigValidator validator;
    private final AtomicReference<ResilienceConfiguration> current = new AtomicReference<>();

    @Autowired
    public ConfigurationRegistry(OnboardPilotProperties properties, ResilienceConfigValidator validator) {
        this(ResilienceConfiguration.from(properties), validator);
    }

    public ConfigurationRegistry(ResilienceConfiguration initial, ResilienceConfigValidator validator) {
        this.validator = validator;
        validator.requireValid(initial);
        current.set(initial);
        log.info("Loaded onboarding configuration version '{}' ({} stages, {} escalation rules)",
                initial.version(), initial.stageCount(), initial.rules().size());
    }

    public ResilienceConfiguration current() {
        return current.get();
    }

    /**
     * Validate and activate a new configuration.
     *
     * @return the configuration that was active before the swap
     * @throws InvalidConfigurationException if the candidate is invalid
     */
    public ResilienceConfiguration reload(ResilienceConfiguration candidate) {
        validator.requireValid(candidate);
        ResilienceConfiguration previous = current.getAndSet(candidate);
        log.info("Reloaded onboarding configuration: '{}' → '{}'", previous.version(), candidate.version());
        return previous;
    }
}
