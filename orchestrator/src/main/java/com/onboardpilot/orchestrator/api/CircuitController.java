package com.onboardpilot.orchestrator.api;

import com.onboardpilot.orchestrator.circuit.CircuitBreakerManager;
import com.onboardpilot.orchestrator.circuit.CircuitSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

/**
 * GET  /circuits                  - every known circuit, configured services included
 * POST /circuits/{service}/reset  - force a circuit CLOSED
 */
@RestController
@RequestMapping("/circuits")
public class CircuitController {

    private static final Logger log = LoggerFactory.getLogger(CircuitController.class);

    private final CircuitBreakerManager circuits;

    public CircuitController(CircuitBreakerManager circuits) {
        this.circuits = circuits;
    }

    @GetMapping
    public List<CircuitSnapshot> list() {
        List<CircuitSnapshot> all = new ArrayList<>(circuits.snapshots());
        for (String service : circuits.monitoredServices()) {
            if (all.stream().noneMatch(c -> c.serviceName().equals(service))) {
                all.add(circuits.snapshot(service));
            }
        }
        all.sort((a, b) -> a.serviceName().compareTo(b.serviceName()));
        return all;
    }

    @PostMapping("/{service}/reset")
    public CircuitSnapshot reset(@PathVariable String service) {
        log.info("Operator reset requested for circuit '{}'", service);
        return circuits.reset(service);
    }
}
