package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.AnalysisContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    @NotNull(message = "Les filtres sont requis")
    @Valid
    private FilterBundle filters;

    @Builder.Default
    @Valid
    private List<GeneratedFeature> features = new ArrayList<>();

    // null = cible stat par défaut (combined_score)
    @Valid
    private TargetDefinition target;

    @Valid
    private CleaningOptions cleaning;

    @Builder.Default
    private AnalysisContext context = AnalysisContext.DEPLOYABLE;
}
