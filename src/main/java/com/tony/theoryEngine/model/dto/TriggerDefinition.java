package com.tony.theoryEngine.model.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerDefinition {

    @Builder.Default
    @DecimalMin(value = "0.0", message = "probThreshold doit être entre 0 et 1")
    @DecimalMax(value = "1.0", message = "probThreshold doit être entre 0 et 1")
    private double probThreshold = 0.55;

    // |p - 0.5| minimum
    @DecimalMin(value = "0.0", message = "confidenceBand doit être entre 0 et 0.5")
    @DecimalMax(value = "0.5", message = "confidenceBand doit être entre 0 et 0.5")
    private Double confidenceBand;

    @DecimalMin(value = "-1.0", message = "minEdgeVsImplied doit être entre -1 et 1")
    @DecimalMax(value = "1.0", message = "minEdgeVsImplied doit être entre -1 et 1")
    private Double minEdgeVsImplied;

    public static TriggerDefinition defaults() {
        return TriggerDefinition.builder().build();
    }
}
