package com.tony.theoryEngine.controller;

import com.tony.theoryEngine.exception.GlobalExceptionHandler;
import com.tony.theoryEngine.exception.RunNotFoundException;
import com.tony.theoryEngine.model.dto.RunSummary;
import com.tony.theoryEngine.service.RunSnapshotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TheoryRunControllerTest {

    @Mock
    private RunSnapshotService runStore;

    @InjectMocks
    private TheoryRunController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /runs : liste des snapshots")
    void listRuns() throws Exception {
        when(runStore.listRuns()).thenReturn(List.of(
                RunSummary.builder().runId("model-1").runType("model").leagueCode("NBA").build()));

        mockMvc.perform(get("/api/v1/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].runId").value("model-1"))
                .andExpect(jsonPath("$[0].leagueCode").value("NBA"));
    }

    @Test
    @DisplayName("GET /runs/{id} inconnu : 404 run_not_found")
    void unknownRun() throws Exception {
        when(runStore.getRun("analyze-missing")).thenThrow(new RunNotFoundException("analyze-missing"));

        mockMvc.perform(get("/api/v1/runs/analyze-missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reasonCode").value("run_not_found"));
    }
}
