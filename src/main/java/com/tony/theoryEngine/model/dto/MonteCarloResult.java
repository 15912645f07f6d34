package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonteCarloResult {
    private int runs;
    private long seed;
    private int betCount;

    private double actualFinalPnl;
    private double actualMaxDrawdown;

    private DistributionSummary finalPnl;
    private DistributionSummary maxDrawdown;

    // Rang centile de la trajectoire réelle dans la distribution bootstrap
    private double luckScore;
    private String luckScoreMethod;
    private double drawdownPercentileRank;

    private Double impliedNullMeanPnl;
    private Double excessVsImplied;

    private Map<String, Object> assumptions;
    private List<String> interpretation;
    private List<String> caveats;
}
