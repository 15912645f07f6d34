package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleaningSummary {
    private int rawRows;
    private int rowsAfterCleaning;
    private int droppedNull;
    private int droppedNonNumeric;
}
