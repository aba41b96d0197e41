package com.onboardpilot.orchestrator.api;

import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import com.onboardpilot.orchestrator.config.ResilienceConfiguration;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** GET /config/version - which configuration the engine is running with. */
@RestController
@RequestMapping("/config")
public class ConfigController {

    private final ConfigurationRegistry config;

    public ConfigController(ConfigurationRegistry config) {
        this.config = config;
    }

    @GetMapping("/version")
    public Map<String, Object> version() {
        ResilienceConfiguration current = config.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version",         current.version());
        body.put("stages",          current.stages());
        body.put("escalationRules", current.rules().size());
        body.put("dynamicEscalation", current.dynamicEscalation().enabled());
        return body;
    }
}
