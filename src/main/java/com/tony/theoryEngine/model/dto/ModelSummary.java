package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.MetricType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelSummary {
    private String modelType;
    private MetricType metricType;
    private int trainingRows;
    private List<String> featuresUsed;
    private List<FeatureWeight> weights;
    private double bias;
    private List<SignalDriver> primarySignalDrivers;
    private Double accuracy;
    private Double roiProxy;
    private Integer roiProxyBets;
    private String roiProxyNote;
}
