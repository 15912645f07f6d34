package com.tony.theoryEngine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tony.theoryEngine.exception.RunNotFoundException;
import com.tony.theoryEngine.model.TheoryRun;
import com.tony.theoryEngine.model.dto.RunDetail;
import com.tony.theoryEngine.model.engine.RunType;
import com.tony.theoryEngine.repository.TheoryRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunSnapshotServiceTest {

    @Mock
    private TheoryRunRepository runRepository;

    private RunSnapshotService service;

    @BeforeEach
    void setUp() {
        service = new RunSnapshotService(runRepository, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    private static Map<String, Object> payload(boolean reversed) {
        Map<String, Object> filters = new LinkedHashMap<>();
        Map<String, Object> payload = new LinkedHashMap<>();
        if (reversed) {
            filters.put("team", "lakers");
            filters.put("leagueCode", "NBA");
            payload.put("filters", filters);
            payload.put("dateStart", LocalDate.of(2024, 1, 1));
            payload.put("operation", "analyze");
        } else {
            payload.put("operation", "analyze");
            payload.put("dateStart", LocalDate.of(2024, 1, 1));
            filters.put("leagueCode", "NBA");
            filters.put("team", "lakers");
            payload.put("filters", filters);
        }
        return payload;
    }

    @Test
    @DisplayName("Le hash ne dépend pas de l'ordre d'insertion des clés")
    void hashIgnoresKeyOrder() {
        String first = service.hash(payload(false));
        String second = service.hash(payload(true));

        assertThat(first).isEqualTo(second).hasSize(64);
        assertThat(service.canonicalJson(payload(true))).contains("\"dateStart\":\"2024-01-01\"");
        assertThat(RunSnapshotService.runId(RunType.ANALYZE, first)).isEqualTo("analyze-" + first.substring(0, 16));
    }

    @Test
    @DisplayName("Un contenu différent donne un hash différent")
    void differentPayloadDifferentHash() {
        Map<String, Object> other = payload(false);
        other.put("operation", "model");

        assertThat(service.hash(other)).isNotEqualTo(service.hash(payload(false)));
    }

    @Test
    @DisplayName("Run déjà stocké : aucune réécriture")
    void commitIsWriteOnce() {
        when(runRepository.existsById("analyze-abc")).thenReturn(true);

        service.commit("analyze-abc", "abc", RunType.ANALYZE, "NBA", "combined_score", 10, payload(false), Map.of());

        verify(runRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Nouveau run : requête et résultat stockés en JSON canonique")
    void commitStoresCanonicalSnapshot() {
        when(runRepository.existsById("analyze-abc")).thenReturn(false);
        ArgumentCaptor<TheoryRun> captor = ArgumentCaptor.forClass(TheoryRun.class);

        service.commit("analyze-abc", "abc", RunType.ANALYZE, "NBA", "combined_score", 10, payload(true), Map.of("b", 2, "a", 1));

        verify(runRepository).saveAndFlush(captor.capture());
        TheoryRun stored = captor.getValue();
        assertThat(stored.getRunType()).isEqualTo("analyze");
        assertThat(stored.getSnapshotHash()).isEqualTo("abc");
        assertThat(stored.getRequestJson()).isEqualTo(service.canonicalJson(payload(false)));
        assertThat(stored.getResultJson()).isEqualTo("{\"a\":1,\"b\":2}");
        assertThat(stored.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Insertion concurrente du même run : pas d'erreur remontée")
    void concurrentInsertIsTolerated() {
        when(runRepository.existsById("analyze-abc")).thenReturn(false);
        when(runRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatCode(() -> service.commit("analyze-abc", "abc", RunType.ANALYZE, "NBA", "combined_score", 10,
                payload(false), Map.of())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Lecture d'un run stocké et liste ordonnée")
    void readsStoredRun() {
        TheoryRun run = new TheoryRun();
        run.setRunId("model-123");
        run.setSnapshotHash("123");
        run.setRunType("model");
        run.setLeagueCode("NBA");
        run.setCreatedAt(LocalDateTime.of(2024, 5, 1, 12, 0));
        run.setRequestJson("{\"operation\":\"model\"}");
        run.setResultJson("{\"runId\":\"model-123\"}");
        when(runRepository.findById("model-123")).thenReturn(Optional.of(run));
        when(runRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(run));

        RunDetail detail = service.getRun("model-123");

        assertThat(detail.getSummary().getRunId()).isEqualTo("model-123");
        assertThat(detail.getRequest().get("operation").asText()).isEqualTo("model");
        assertThat(detail.getResult().get("runId").asText()).isEqualTo("model-123");
        assertThat(service.listRuns()).hasSize(1);
    }

    @Test
    @DisplayName("Run inconnu : RunNotFoundException")
    void unknownRun() {
        when(runRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getRun("nope"))
                .isInstanceOf(RunNotFoundException.class)
                .hasMessageContaining("nope");
    }
}
