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
public class FailureAnalysis {
    private List<BetTapeEntry> largestLosses;
    private List<BetTapeEntry> overconfidentLosses;
    private List<SliceMetrics> edgeBuckets;
    private List<String> notes;
}
