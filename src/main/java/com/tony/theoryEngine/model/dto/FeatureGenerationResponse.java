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
public class FeatureGenerationResponse {
    private String leagueCode;
    private List<GeneratedFeature> features;
    private List<String> skippedStats;
    private int rollingWindow;
    private String summary;
}
