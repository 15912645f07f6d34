package com.tony.theoryEngine.model.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Une ligne par match et par côté ciblé. Jamais persistée en dehors du snapshot.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CohortRow {
    private Long gameId;
    private LocalDate gameDate;
    private int season;
    private String homeTeam;
    private String awayTeam;
    private int homeScore;
    private int awayScore;
    private String side;

    private Map<String, Object> features;

    // Cible : valeur numérique, ou 1/0 pour une cible binaire
    private Double targetValue;
    private BetOutcome outcome;

    // Marché (null pour les cibles stat)
    private Double line;
    private Double price;
    private Double impliedProb;

    // Rempli par le modèle et le trigger
    private Double modelProb;
    private Double edge;
    private boolean triggered;
    private List<String> triggerReasons;

    public boolean hasOdds() {
        return price != null;
    }

    public boolean isSettled() {
        return outcome == BetOutcome.WIN || outcome == BetOutcome.LOSS;
    }
}
