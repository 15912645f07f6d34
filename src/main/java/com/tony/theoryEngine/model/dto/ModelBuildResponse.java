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
public class ModelBuildResponse {
    private String runId;
    private ModelSnapshot modelSnapshot;
    private TheoryEvaluation evaluation;
    private CleaningSummary cleaningSummary;
    private FeaturePolicyReport featurePolicy;
    private StageStatus<ModelSummary> modeling;
    private List<DroppedFeature> featuresDropped;
    private StageStatus<BetSimulation> simulation;
    private StageStatus<MonteCarloResult> monteCarlo;
    private List<String> notes;
}
