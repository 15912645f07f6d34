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
public class ExposureControls {

    // null = pas de plafond
    @Builder.Default
    @PositiveOrZero(message = "maxBetsPerDay doit être positif ou nul")
    private Integer maxBetsPerDay = 5;

    @PositiveOrZero(message = "maxBetsPerSidePerDay doit être positif ou nul")
    private Integer maxBetsPerSidePerDay;

    @PositiveOrZero(message = "spreadAbsMin doit être positif ou nul")
    private Double spreadAbsMin;

    @PositiveOrZero(message = "spreadAbsMax doit être positif ou nul")
    private Double spreadAbsMax;

    public static ExposureControls defaults() {
        return ExposureControls.builder().build();
    }
}
