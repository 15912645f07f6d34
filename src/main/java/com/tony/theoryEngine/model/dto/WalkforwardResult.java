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
public class WalkforwardResult {
    private WalkforwardWindow window;
    private int effectiveStepDays;
    private Integer edgeHalfLifeDays;
    private List<WalkforwardSlice> slices;
    private int skippedWindows;
    private List<String> notes;
}
