package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.FeatureCategory;
import com.tony.theoryEngine.model.engine.FeatureTiming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedFeature {
    @NotBlank(message = "Le nom de la feature est requis")
    private String name;
    private String formula;
    private FeatureCategory category;
    private String group;
    private FeatureTiming timing;
}
