package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.AnalysisContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeaturePolicyReport {
    private AnalysisContext context;
    private List<String> keptFeatures;
    private List<String> droppedPostGameFeatures;
    private List<String> droppedTargetLeakageFeatures;
    private boolean containsPostGameFeatures;
    private List<String> notes;
}
