package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.CleaningOptions;
import com.tony.theoryEngine.model.dto.CleaningSummary;
import com.tony.theoryEngine.model.engine.CohortRow;
import com.tony.theoryEngine.util.NumericValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Admission des lignes selon les options de nettoyage. Chaque rejet est compté.
 * Règles évaluées dans l'ordre, la première qui s'applique l'emporte :
 * non numérique, au moins une valeur nulle, toutes nulles, minimum de valeurs non nulles.
 */
@Slf4j
@Service
public class DatasetPreparationService {

    public record CleaningResult(List<CohortRow> kept, CleaningSummary summary) {
    }

    public CleaningResult clean(List<CohortRow> rows, List<String> featureNames, CleaningOptions options) {
        List<CohortRow> kept = new ArrayList<>(rows.size());
        int droppedNull = 0;
        int droppedNonNumeric = 0;

        for (CohortRow row : rows) {
            Map<String, Object> values = row.getFeatures();
            int nonNull = 0;
            boolean anyNonNumeric = false;
            for (String name : featureNames) {
                Object value = values == null ? null : values.get(name);
                if (NumericValues.isNonNumeric(value)) {
                    anyNonNumeric = true;
                } else if (value != null) {
                    nonNull++;
                }
            }
            int total = featureNames.size();

            if (options.isDropIfNonNumeric() && anyNonNumeric) {
                droppedNonNumeric++;
            } else if (options.isDropIfAnyNull() && total > 0 && nonNull < total) {
                droppedNull++;
            } else if (options.isDropIfAllNull() && total > 0 && nonNull == 0) {
                droppedNull++;
            } else if (options.getMinNonNullFeatures() != null && nonNull < options.getMinNonNullFeatures()) {
                droppedNull++;
            } else {
                kept.add(row);
            }
        }

        CleaningSummary summary = CleaningSummary.builder()
                .rawRows(rows.size())
                .rowsAfterCleaning(kept.size())
                .droppedNull(droppedNull)
                .droppedNonNumeric(droppedNonNumeric)
                .build();
        if (droppedNull + droppedNonNumeric > 0) {
            log.debug("🧹 Nettoyage : {} -> {} lignes (nulles={}, non numériques={})",
                    rows.size(), kept.size(), droppedNull, droppedNonNumeric);
        }
        return new CleaningResult(kept, summary);
    }
}
