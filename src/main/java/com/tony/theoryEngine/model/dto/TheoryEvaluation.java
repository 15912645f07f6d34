package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.OddsAssumption;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.model.engine.TargetClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Cohorte vs population. Les statistiques restent nulles quand l'échantillon est vide.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TheoryEvaluation {
    private TargetClass targetClass;
    private String targetName;
    private MetricType metricType;

    private int sampleSize;
    private int baselineSampleSize;

    private Double baselineValue;
    private Double cohortValue;
    private Double delta;

    // Cible stat
    private Double cohortStd;
    private Double cohortMin;
    private Double cohortMax;
    private Double cohortP25;
    private Double cohortP75;

    // Cible marché
    private Integer wins;
    private Integer losses;
    private Integer pushes;
    private Double impliedRate;
    private Double evVsImplied;
    private Double roiUnits;
    private Double oddsCoveragePct;
    private OddsAssumption oddsAssumption;

    private List<StabilityBucket> stabilityBySeason;
    private List<StabilityBucket> stabilityByMonth;

    private String verdict;
    private String sampleBand;
    private ReasonCode reasonCode;
    private List<String> notes;
}
