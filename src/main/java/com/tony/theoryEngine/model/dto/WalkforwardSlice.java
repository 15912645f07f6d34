package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalkforwardSlice {
    private LocalDate trainStart;
    private LocalDate startDate;
    private LocalDate endDate;
    private int trainRows;
    private int sampleSize;
    private int betCount;
    private Double hitRate;
    private Double roiUnits;
    private Double edgeAvg;
    private Double oddsCoveragePct;
}
