package com.tony.theoryEngine.model.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleaningOptions {
    private boolean dropIfAllNull;
    private boolean dropIfAnyNull;
    private boolean dropIfNonNumeric;

    @PositiveOrZero(message = "minNonNullFeatures doit être positif ou nul")
    private Integer minNonNullFeatures;

    public static CleaningOptions none() {
        return new CleaningOptions();
    }
}
