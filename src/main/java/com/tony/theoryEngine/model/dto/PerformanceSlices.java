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
public class PerformanceSlices {
    private SliceMetrics overall;
    private List<SliceMetrics> byConfidence;
    private List<SliceMetrics> bySpreadBucket;
    private List<SliceMetrics> byFavoriteUnderdog;
    private List<String> notes;
}
