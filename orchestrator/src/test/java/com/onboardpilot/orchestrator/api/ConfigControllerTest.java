package com.onboardpilot.orchestrator.api;

import com.onboardpilot.orchestrator.TestConfigs;
import com.onboardpilot.orchestrator.config.ConfigurationRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired MockMvc                  mockMvc;
    @MockitoBean ConfigurationRegistry  config;

    @Test
    void version_reportsActiveConfiguration() throws Exception {
        when(config.current()).thenReturn(TestConfigs.config());

        mockMvc.perform(get("/config/version"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("test-1"))
                .andExpect(jsonPath("$.stages[0]").value("DATA_AGGREGATION"))
                .andExpect(jsonPath("$.stages[1]").value("IT_PROVISIONING"))
                .andExpect(jsonPath("$.dynamicEscalation").value(true));
    }
}
