package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.GamePhase;
import com.tony.theoryEngine.model.engine.MetricType;
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
public class LeagueReference {
    private String code;
    private String name;
    private String level;
    private List<String> statKeys;
    private Map<String, MetricType> statTargets;
    private List<GamePhase> phases;
    private List<Integer> seasons;
}
