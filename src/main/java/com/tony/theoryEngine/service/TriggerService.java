package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.dto.TriggerDefinition;
import com.tony.theoryEngine.model.engine.CohortRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Calcul de l'edge et décision de déclenchement, ligne par ligne.
 */
@Slf4j
@Service
public class TriggerService {

    public static final String BELOW_THRESHOLD = "below_threshold";
    public static final String INSIDE_CONFIDENCE_BAND = "inside_confidence_band";
    public static final String EDGE_BELOW_MIN = "edge_below_min";
    public static final String MISSING_MODEL_PROB = "missing_model_prob";
    public static final String MISSING_IMPLIED_PROB = "missing_implied_prob";

    private static final double COIN_FLIP = 0.5;
    // Bornes inclusives : 0.60 - 0.5 vaut 0.0999..., on tolère l'erreur d'arrondi
    static final double BOUNDARY_TOLERANCE = 1e-9;

    public List<CohortRow> apply(List<CohortRow> scored, TargetDefinition target, TriggerDefinition trigger) {
        TriggerDefinition rules = trigger != null ? trigger : TriggerDefinition.defaults();
        List<CohortRow> out = new ArrayList<>(scored.size());
        int triggered = 0;

        for (CohortRow row : scored) {
            Double p = row.getModelProb();
            Double edge = edge(row, target);
            List<String> reasons = new ArrayList<>();

            if (p == null) {
                reasons.add(MISSING_MODEL_PROB);
            } else {
                if (p < rules.getProbThreshold() - BOUNDARY_TOLERANCE) {
                    reasons.add(BELOW_THRESHOLD);
                }
                if (rules.getConfidenceBand() != null && Math.abs(p - COIN_FLIP) < rules.getConfidenceBand() - BOUNDARY_TOLERANCE) {
                    reasons.add(INSIDE_CONFIDENCE_BAND);
                }
            }
            if (target.isMarket() && row.getImpliedProb() == null) {
                reasons.add(MISSING_IMPLIED_PROB);
            }
            if (rules.getMinEdgeVsImplied() != null && edge != null && edge < rules.getMinEdgeVsImplied() - BOUNDARY_TOLERANCE) {
                reasons.add(EDGE_BELOW_MIN);
            }

            boolean fires = reasons.isEmpty();
            if (fires) {
                triggered++;
            }
            out.add(row.toBuilder()
                    .edge(edge)
                    .triggered(fires)
                    .triggerReasons(List.copyOf(reasons))
                    .build());
        }
        log.info("🎯 Trigger : {} lignes déclenchées sur {} (seuil {})", triggered, scored.size(), rules.getProbThreshold());
        return out;
    }

    // Marché : p - proba implicite. Stat binaire : p - 0.5.
    static Double edge(CohortRow row, TargetDefinition target) {
        if (row.getModelProb() == null) {
            return null;
        }
        if (target.isMarket()) {
            return row.getImpliedProb() == null ? null : row.getModelProb() - row.getImpliedProb();
        }
        return row.getModelProb() - COIN_FLIP;
    }
}
