package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalkforwardResponse {
    private String runId;
    private String snapshotHash;
    private StageStatus<WalkforwardResult> result;
}
