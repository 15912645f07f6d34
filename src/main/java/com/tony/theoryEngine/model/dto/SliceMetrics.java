package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SliceMetrics {
    private String label;
    private int n;
    private int wins;
    private int losses;
    private int pushes;
    private Double hitRate;
    private double pnlUnits;
    private Double roiPerBet;
    private Double avgModelProb;
    private Double avgImpliedProb;
    private Double avgEdge;
    private Double hitMinusImplied;
    private boolean redZone;
}
