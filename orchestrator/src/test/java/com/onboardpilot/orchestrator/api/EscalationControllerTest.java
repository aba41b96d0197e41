package com.onboardpilot.orchestrator.api;

import com.onboardpilot.orchestrator.escalation.EscalationAlreadyResolvedException;
import com.onboardpilot.orchestrator.escalation.EscalationNotFoundException;
import com.onboardpilot.orchestrator.escalation.EscalationRuleEngine;
import com.onboardpilot.orchestrator.model.EscalationEvent;
import com.onboardpilot.orchestrator.model.EscalationLevel;
import com.onboardpilot.orchestrator.model.PipelineStage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EscalationController.class)
class EscalationControllerTest {

    @Autowired MockMvc                 mockMvc;
    @MockitoBean EscalationRuleEngine  escalations;

    @Test
    void acknowledge_existingEvent_returnsAcknowledgedEvent() throws Exception {
        EscalationEvent event = event();
        event.acknowledge("dana", Instant.parse("2026-03-02T10:05:00Z"));
        when(escalations.acknowledge(event.getId(), "dana")).thenReturn(event);

        mockMvc.perform(post("/escalations/{id}/acknowledge", event.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operator":"dana"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ruleId").value("critical_sla_breach"))
                .andExpect(jsonPath("$.acknowledgedBy").value("dana"));
    }

    @Test
    void acknowledge_unknownEvent_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(escalations.acknowledge(unknown, "dana")).thenThrow(new EscalationNotFoundException(unknown));

        mockMvc.perform(post("/escalations/{id}/acknowledge", unknown)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operator":"dana"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void resolve_alreadyResolved_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(escalations.resolve(id, "sam", "again"))
                .thenThrow(new EscalationAlreadyResolvedException(id, "lee"));

        mockMvc.perform(post("/escalations/{id}/resolve", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"operator":"sam","note":"again"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Escalation event " + id + " was already resolved by lee"));
    }

    @Test
    void resolve_missingOperator_returns400() throws Exception {
        mockMvc.perform(post("/escalations/{id}/resolve", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"note":"done"}
                                """))
                .andExpect(status().isBadRequest());
    }

    private static EscalationEvent event() {
        return new EscalationEvent(UUID.randomUUID(), "critical_sla_breach", EscalationLevel.CRITICAL,
                PipelineStage.IT_PROVISIONING, "SLA BREACHED", "Critical SLA breach", List.of("operations_team"),
                true, false, Instant.parse("2026-03-02T10:00:00Z"));
    }
}
