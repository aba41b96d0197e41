package com.onboardpilot.orchestrator.api;

import com.onboardpilot.orchestrator.api.dto.EscalationResponse;
import com.onboardpilot.orchestrator.api.dto.OperatorRequest;
import com.onboardpilot.orchestrator.escalation.EscalationRuleEngine;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Operator handling of escalation events.
 *
 * POST /escalations/{id}/acknowledge - idempotent
 * POST /escalations/{id}/resolve     - 409 if already resolved
 */
@RestController
@RequestMapping("/escalations")
public class EscalationController {

    private final EscalationRuleEngine escalations;

    public EscalationController(EscalationRuleEngine escalations) {
        this.escalations = escalations;
    }

    @PostMapping("/{id}/acknowledge")
    public EscalationResponse acknowledge(@PathVariable UUID id, @Valid @RequestBody OperatorRequest req) {
        return EscalationResponse.from(escalations.acknowledge(id, req.operator()));
    }

    @PostMapping("/{id}/resolve")
    public EscalationResponse resolve(@PathVariable UUID id, @Valid @RequestBody OperatorRequest req) {
        return EscalationResponse.from(escalations.resolve(id, req.operator(), req.note()));
    }
}
