package com.tony.theoryEngine.model.dto;

import jakarta.validation.constraints.NotBlank;
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
public class FeatureGenerationRequest {
    @NotBlank(message = "Le code ligue est requis")
    private String leagueCode;

    @Builder.Default
    private List<String> rawStats = new ArrayList<>();

    private boolean includeRestDays;
    private boolean includeRolling;

    // Borné à [2, 20] par le générateur
    private Integer rollingWindow;
}
