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
public class BetSimulation {
    private ExposureSummary exposureSummary;
    private List<BetTapeEntry> betTape;
    private PerformanceSlices performanceSlices;
    private FailureAnalysis failureAnalysis;
}
