package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.BetOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BetTapeEntry {
    private int sequence;
    private Long gameId;
    private LocalDate gameDate;
    private String matchup;
    private String side;
    private Double line;
    private Double price;
    private Double modelProb;
    private Double impliedProb;
    private Double edge;
    private BetOutcome outcome;
    private double stake;
    private double pnl;
    private double cumulativePnl;
    private double drawdown;
}
