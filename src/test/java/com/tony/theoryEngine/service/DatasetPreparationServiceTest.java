package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.CleaningOptions;
import com.tony.theoryEngine.model.engine.CohortRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DatasetPreparationServiceTest {

    private static final List<String> FEATURES = List.of("a", "b");

    private final DatasetPreparationService service = new DatasetPreparationService();

    private static CohortRow row(long id, Object a, Object b) {
        Map<String, Object> features = new HashMap<>();
        features.put("a", a);
        features.put("b", b);
        return CohortRow.builder().gameId(id).gameDate(LocalDate.of(2024, 1, 1)).features(features).build();
    }

    private final List<CohortRow> rows = List.of(
            row(1, 1.0, 2.0),
            row(2, 1.0, null),
            row(3, null, null),
            row(4, "abc", 2.0),
            row(5, "12:30", "45%"));

    @Test
    @DisplayName("Sans option, toutes les lignes sont conservées")
    void noOptionsKeepsEverything() {
        DatasetPreparationService.CleaningResult result = service.clean(rows, FEATURES, CleaningOptions.none());

        assertThat(result.kept()).hasSize(5);
        assertThat(result.summary().getRawRows()).isEqualTo(5);
        assertThat(result.summary().getDroppedNull() + result.summary().getDroppedNonNumeric()).isZero();
    }

    @Test
    @DisplayName("Non numérique prioritaire sur les règles de nullité")
    void nonNumericTakesPrecedence() {
        CleaningOptions options = CleaningOptions.builder()
                .dropIfNonNumeric(true)
                .dropIfAnyNull(true)
                .build();

        DatasetPreparationService.CleaningResult result = service.clean(rows, FEATURES, options);

        // La ligne 4 a aussi une valeur exploitable mais "abc" la fait tomber en non numérique
        assertThat(result.kept()).extracting(CohortRow::getGameId).containsExactly(1L, 5L);
        assertThat(result.summary().getDroppedNonNumeric()).isEqualTo(1);
        assertThat(result.summary().getDroppedNull()).isEqualTo(2);
        assertThat(result.summary().getRowsAfterCleaning()).isEqualTo(2);
    }

    @Test
    @DisplayName("dropIfAllNull ne retire que les lignes entièrement vides")
    void dropIfAllNullOnlyRemovesEmptyRows() {
        CleaningOptions options = CleaningOptions.builder().dropIfAllNull(true).build();

        DatasetPreparationService.CleaningResult result = service.clean(rows, FEATURES, options);

        assertThat(result.kept()).extracting(CohortRow::getGameId).containsExactly(1L, 2L, 4L, 5L);
        assertThat(result.summary().getDroppedNull()).isEqualTo(1);
    }

    @Test
    @DisplayName("minNonNullFeatures compte les valeurs numériques non nulles")
    void minNonNullFeatures() {
        CleaningOptions options = CleaningOptions.builder().minNonNullFeatures(2).build();

        DatasetPreparationService.CleaningResult result = service.clean(rows, FEATURES, options);

        assertThat(result.kept()).extracting(CohortRow::getGameId).containsExactly(1L, 5L);
        assertThat(result.summary().getDroppedNull()).isEqualTo(3);
    }
}
