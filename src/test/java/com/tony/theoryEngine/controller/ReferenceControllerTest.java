package com.tony.theoryEngine.controller;

import com.tony.theoryEngine.exception.GlobalExceptionHandler;
import com.tony.theoryEngine.service.HistoricalGameStore;
import com.tony.theoryEngine.service.LeagueCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ReferenceControllerTest {

    @Mock
    private HistoricalGameStore gameStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ReferenceController controller = new ReferenceController(new LeagueCatalogService(), gameStore);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /leagues : catalogue complet")
    void listsLeagues() throws Exception {
        mockMvc.perform(get("/api/v1/references/leagues"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)))
                .andExpect(jsonPath("$[0].code").value("NBA"))
                .andExpect(jsonPath("$[0].statTargets.combined_score").value("numeric"));
    }

    @Test
    @DisplayName("GET /leagues/ncaab : phases et saisons en base")
    void leagueDetail() throws Exception {
        when(gameStore.listSeasons("NCAAB")).thenReturn(List.of(2022, 2023));

        mockMvc.perform(get("/api/v1/references/leagues/ncaab"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("NCAAB"))
                .andExpect(jsonPath("$.seasons", hasSize(2)))
                .andExpect(jsonPath("$.phases", hasSize(4)));
    }

    @Test
    @DisplayName("Ligue inconnue : 400 unknown_league")
    void unknownLeague() throws Exception {
        mockMvc.perform(get("/api/v1/references/leagues/xfl"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reasonCode").value("unknown_league"));
    }
}
