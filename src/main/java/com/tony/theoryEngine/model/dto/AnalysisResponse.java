package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {
    private String runId;
    private String snapshotHash;
    private int sampleSize;
    private Double baselineValue;
    private Double cohortValue;
    private Double delta;
    private List<CorrelationResult> correlations;
    private List<String> insights;
    private CleaningSummary cleaningSummary;
    private FeaturePolicyReport featurePolicy;
    private TheoryEvaluation evaluation;
    private StageStatus<ModelSummary> modeling;
    private List<String> notes;
}
