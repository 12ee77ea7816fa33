package com.company.decommissioning.controller;

import com.company.decommissioning.exception.GlobalExceptionHandler;
import com.company.decommissioning.exception.PolicyConfigException;
import com.company.decommissioning.service.PolicyRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("PolicyController Unit Tests")
class PolicyControllerTest {

    private static final String RELOAD_BODY = """
            {"databases": [
              {"id": "pagila", "criticality": "MEDIUM", "scenario": "MIXED", "ownerEmail": "development-team@company.com"},
              {"id": "lego", "criticality": "CRITICAL", "scenario": "LOGIC_HEAVY", "ownerEmail": "analytics-team@company.com"}
            ]}
            """;

    @Mock
    private PolicyRegistry policyRegistry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PolicyController(policyRegistry, new SimpleMeterRegistry()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("A valid reload reports added and removed databases")
    void shouldReload() throws Exception {
        when(policyRegistry.reload(anyList()))
                .thenReturn(new PolicyRegistry.ReloadSummary(2, Set.of("lego"), Set.of("titanic")));

        mockMvc.perform(post("/api/v1/policies/reload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RELOAD_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalDatabases").value(2))
                .andExpect(jsonPath("$.added[0]").value("lego"))
                .andExpect(jsonPath("$.removed[0]").value("titanic"));
    }

    @Test
    @DisplayName("An invalid reload is rejected with the list of problems")
    void invalidReloadIs400() throws Exception {
        when(policyRegistry.reload(anyList()))
                .thenThrow(new PolicyConfigException(List.of("databases[1] (lego): unknown scenario 'LOGIC'")));

        mockMvc.perform(post("/api/v1/policies/reload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RELOAD_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problems[0]").value("databases[1] (lego): unknown scenario 'LOGIC'"));
    }

    @Test
    @DisplayName("A request without a database list fails validation")
    void missingListIs400() throws Exception {
        mockMvc.perform(post("/api/v1/policies/reload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.databases").value("Database list is required"));

        verifyNoInteractions(policyRegistry);
    }
}
