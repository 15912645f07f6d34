package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {
    private String runId;
    private String snapshotHash;
    private String runType;
    private String leagueCode;
    private String targetName;
    private Integer sampleSize;
    private LocalDateTime createdAt;
}
