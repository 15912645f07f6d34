package com.tony.theoryEngine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExposureSummary {
    private int candidateRows;
    private int triggered;
    private int selected;
    private int droppedDueToControls;
    private int droppedBySpreadBand;
    private int uniqueDays;
    private double avgBetsPerDay;
    private Map<String, Integer> bySide;
    private Map<String, Integer> triggerRejections;
    private double finalPnl;
    private double maxDrawdown;
    private List<String> notes;
    private List<String> warnings;
}
