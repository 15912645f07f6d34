package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.model.dto.DroppedFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Élagage avant ajustement, dans l'ordre : colonnes vides / trop incomplètes / constantes,
 * puis doublons et quasi-colinéarités (la première feature déclarée est conservée).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeaturePruningService {

    public static final String MISSING_COLUMN = "missing_column";
    public static final String TOO_MANY_MISSING = "too_many_missing";
    public static final String TOO_FEW_VALUES = "too_few_values";
    public static final String ZERO_VARIANCE = "zero_variance";
    public static final String DUPLICATE_VECTOR = "duplicate_vector";
    public static final String NEAR_COLLINEAR = "near_collinear";
    public static final String NEAR_ZERO_WEIGHT = "near_zero_weight";
    public static final String MODEL_FIT_FAILED = "model_fit_failed";

    private final TheoryEngineProperties properties;

    public record PruningResult(List<Integer> keptColumns, List<DroppedFeature> dropped) {
    }

    /**
     * @param x matrice lignes x features, NaN pour une valeur absente
     */
    public PruningResult prune(double[][] x, List<String> names) {
        TheoryEngineProperties.Pruning cfg = properties.getPruning();
        int n = x.length;
        List<DroppedFeature> dropped = new ArrayList<>();
        List<Integer> candidates = new ArrayList<>();

        for (int j = 0; j < names.size(); j++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (double[] row : x) {
                if (!Double.isNaN(row[j])) {
                    stats.addValue(row[j]);
                }
            }
            long count = stats.getN();
            double missingFraction = n == 0 ? 1.0 : 1.0 - (double) count / n;
            if (count == 0) {
                dropped.add(drop(names.get(j), MISSING_COLUMN, null, null));
            } else if (missingFraction >= cfg.getMaxMissingFraction()) {
                dropped.add(drop(names.get(j), TOO_MANY_MISSING, null, missingFraction));
            } else if (count < cfg.getMinValues()) {
                dropped.add(drop(names.get(j), TOO_FEW_VALUES, null, (double) count));
            } else if (Math.sqrt(stats.getPopulationVariance()) < cfg.getMinStd()) {
                dropped.add(drop(names.get(j), ZERO_VARIANCE, null, stats.getMean()));
            } else {
                candidates.add(j);
            }
        }

        // Doublons : comparaison sur vecteurs imputés à la moyenne
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        Map<Integer, double[]> imputed = new HashMap<>();
        Map<String, Integer> signatures = new HashMap<>();
        List<Integer> kept = new ArrayList<>();
        for (int j : candidates) {
            double[] column = imputedColumn(x, j);
            imputed.put(j, column);
            String signature = signature(column);
            Integer same = signatures.get(signature);
            if (same != null) {
                dropped.add(drop(names.get(j), DUPLICATE_VECTOR, names.get(same), 1.0));
                continue;
            }
            Integer collinearWith = null;
            double collinearity = 0;
            for (int k : kept) {
                double r = Math.abs(pearson.correlation(imputed.get(k), column));
                if (!Double.isNaN(r) && r >= cfg.getCollinearityThreshold()) {
                    collinearWith = k;
                    collinearity = r;
                    break;
                }
            }
            if (collinearWith != null) {
                dropped.add(drop(names.get(j), NEAR_COLLINEAR, names.get(collinearWith), collinearity));
                continue;
            }
            signatures.put(signature, j);
            kept.add(j);
        }

        if (!dropped.isEmpty()) {
            log.info("✂️ Élagage : {} features conservées, {} écartées", kept.size(), dropped.size());
            dropped.forEach(d -> log.debug("   - {} : {}{}", d.getFeature(), d.getReason(),
                    d.getDuplicateOf() != null ? " (avec " + d.getDuplicateOf() + ")" : ""));
        }
        return new PruningResult(kept, dropped);
    }

    static double[] imputedColumn(double[][] x, int j) {
        double sum = 0;
        int count = 0;
        for (double[] row : x) {
            if (!Double.isNaN(row[j])) {
                sum += row[j];
                count++;
            }
        }
        double mean = count == 0 ? 0 : sum / count;
        double[] column = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            column[i] = Double.isNaN(x[i][j]) ? mean : x[i][j];
        }
        return column;
    }

    private static String signature(double[] column) {
        return Arrays.toString(Arrays.stream(column).map(v -> Math.round(v * 1e6) / 1e6).toArray());
    }

    static DroppedFeature drop(String feature, String reason, String duplicateOf, Double value) {
        return DroppedFeature.builder()
                .feature(feature)
                .reason(reason)
                .duplicateOf(duplicateOf)
                .value(value)
                .build();
    }
}
