package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.GamePhase;
import com.tony.theoryEngine.model.engine.SeasonScope;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterBundle {

    @NotBlank(message = "Le code ligue est requis")
    private String leagueCode;

    // Vide = toutes les saisons de la ligue
    @Builder.Default
    private List<Integer> seasons = new ArrayList<>();

    @Builder.Default
    private SeasonScope seasonScope = SeasonScope.FULL;

    @Positive(message = "recentDays doit être positif")
    private Integer recentDays;

    // NCAAB uniquement, ignoré ailleurs
    @Builder.Default
    private GamePhase phase = GamePhase.ALL;

    private LocalDate dateStart;
    private LocalDate dateEnd;

    private String team;
    private String player;

    // Bande sur |spread domicile|, appliquée seulement aux cibles spread
    private Double spreadMin;
    private Double spreadMax;
}
