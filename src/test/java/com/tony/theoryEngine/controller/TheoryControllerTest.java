package com.tony.theoryEngine.controller;

import com.tony.theoryEngine.exception.GlobalExceptionHandler;
import com.tony.theoryEngine.exception.OperationTimeoutException;
import com.tony.theoryEngine.exception.TheoryConfigurationException;
import com.tony.theoryEngine.exception.UpstreamUnavailableException;
import com.tony.theoryEngine.model.dto.AnalysisRequest;
import com.tony.theoryEngine.model.dto.AnalysisResponse;
import com.tony.theoryEngine.model.dto.ModelBuildRequest;
import com.tony.theoryEngine.model.dto.WalkforwardRequest;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.service.TheoryAnalysisOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TheoryControllerTest {

    private static final String NBA_REQUEST = "{\"filters\":{\"leagueCode\":\"NBA\"}}";

    @Mock
    private TheoryAnalysisOrchestrator orchestrator;

    @InjectMocks
    private TheoryController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /analyze : 200 avec le runId")
    void analyzeOk() throws Exception {
        when(orchestrator.analyze(any(AnalysisRequest.class)))
                .thenReturn(AnalysisResponse.builder().runId("analyze-0123456789abcdef").sampleSize(12).build());

        mockMvc.perform(post("/api/v1/theories/analyze").contentType(MediaType.APPLICATION_JSON).content(NBA_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("analyze-0123456789abcdef"))
                .andExpect(jsonPath("$.sampleSize").value(12));
    }

    @Test
    @DisplayName("Filtres manquants : 400 invalid_configuration sans appel au moteur")
    void missingFiltersAreRejected() throws Exception {
        mockMvc.perform(post("/api/v1/theories/analyze").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reasonCode").value("invalid_configuration"))
                .andExpect(jsonPath("$.details[0].field").value("filters"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("Corps illisible : 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/theories/model").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reasonCode").value("invalid_configuration"));
    }

    @Test
    @DisplayName("Configuration refusée par le moteur : 400 avec le code et le champ")
    void configurationErrorIsBadRequest() throws Exception {
        when(orchestrator.buildModel(any(ModelBuildRequest.class))).thenThrow(new TheoryConfigurationException(
                "features[0].name", ReasonCode.UNKNOWN_FEATURE, "Feature inconnue pour NBA : foo"));

        mockMvc.perform(post("/api/v1/theories/model").contentType(MediaType.APPLICATION_JSON).content(NBA_REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reasonCode").value("unknown_feature"))
                .andExpect(jsonPath("$.details[0].field").value("features[0].name"))
                .andExpect(jsonPath("$.path").value("/api/v1/theories/model"));
    }

    @Test
    @DisplayName("Store indisponible : 503 upstream_unavailable")
    void upstreamUnavailable() throws Exception {
        when(orchestrator.runWalkforward(any(WalkforwardRequest.class))).thenThrow(new UpstreamUnavailableException(
                "Historical Game Store indisponible (games)", new DataAccessResourceFailureException("down")));

        mockMvc.perform(post("/api/v1/theories/walkforward").contentType(MediaType.APPLICATION_JSON).content(NBA_REQUEST))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.reasonCode").value("upstream_unavailable"));
    }

    @Test
    @DisplayName("Délai dépassé : 504 operation_timeout")
    void timeout() throws Exception {
        when(orchestrator.analyze(any(AnalysisRequest.class))).thenThrow(new OperationTimeoutException("L'opération analyze a dépassé 300s"));

        mockMvc.perform(post("/api/v1/theories/analyze").contentType(MediaType.APPLICATION_JSON).content(NBA_REQUEST))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.reasonCode").value("operation_timeout"));
    }

    @Test
    @DisplayName("Erreur inattendue : 500 sans détail interne")
    void unexpectedError() throws Exception {
        when(orchestrator.analyze(any(AnalysisRequest.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/theories/analyze").contentType(MediaType.APPLICATION_JSON).content(NBA_REQUEST))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.reasonCode").value("internal_error"))
                .andExpect(jsonPath("$.message").value("Unexpected error"));
    }
}
