package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationResult {
    private String feature;
    private double correlation;
    private int sampleSize;
    private boolean significant;
}
