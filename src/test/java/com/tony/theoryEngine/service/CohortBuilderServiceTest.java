package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.FilterBundle;
import com.tony.theoryEngine.model.engine.GamePhase;
import com.tony.theoryEngine.model.engine.GameSnapshot;
import com.tony.theoryEngine.model.engine.MarketType;
import com.tony.theoryEngine.model.engine.SeasonScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.tony.theoryEngine.service.GameFixtures.LAKERS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CohortBuilderServiceTest {

    @Mock
    private HistoricalGameStore gameStore;

    @InjectMocks
    private CohortBuilderService cohortBuilder;

    private final List<GameSnapshot> history = GameFixtures.season(LocalDate.of(2023, 11, 1), 90, 11L, true);

    @Test
    @DisplayName("Filtre équipe Lakers : la cohorte contient exactement les matchs des Lakers")
    void lakersCohortMatchesTeamGames() {
        FilterBundle filters = FilterBundle.builder().leagueCode("NBA").team("lakers").build();

        CohortBuilderService.CohortSelection selection = cohortBuilder.select(history, filters, TargetDefinitions.defaultTarget());

        long expected = history.stream()
                .filter(g -> g.homeTeam().equals(LAKERS) || g.awayTeam().equals(LAKERS))
                .count();
        assertThat(selection.baseline()).hasSize(history.size());
        assertThat(selection.cohortIds()).hasSize((int) expected);
        assertThat(selection.cohort()).allMatch(g -> g.homeTeam().equals(LAKERS) || g.awayTeam().equals(LAKERS));
        verifyNoInteractions(gameStore);
    }

    @Test
    @DisplayName("La cohorte est toujours incluse dans la population")
    void cohortIsSubsetOfBaseline() {
        FilterBundle filters = FilterBundle.builder()
                .leagueCode("NBA")
                .team("bos")
                .seasonScope(SeasonScope.RECENT)
                .recentDays(30)
                .spreadMin(2.0)
                .spreadMax(6.0)
                .build();

        CohortBuilderService.CohortSelection selection = cohortBuilder.select(history, filters,
                TargetDefinitions.market(MarketType.SPREAD, "home"));

        Set<Long> baselineIds = selection.baseline().stream().map(GameSnapshot::id).collect(Collectors.toSet());
        assertThat(baselineIds).containsAll(selection.cohortIds());
        assertThat(selection.baseline()).hasSizeLessThan(history.size());
        assertThat(selection.cohort()).allMatch(g -> CohortBuilderService.inSpreadBand(g, filters));
    }

    @Test
    @DisplayName("La bande de spread est ignorée (avec une note) pour une cible stat")
    void spreadBandIgnoredForStatTarget() {
        FilterBundle filters = FilterBundle.builder().leagueCode("NBA").spreadMin(3.0).build();

        CohortBuilderService.CohortSelection selection = cohortBuilder.select(history, filters, TargetDefinitions.defaultTarget());

        assertThat(selection.cohortIds()).hasSize(history.size());
        assertThat(selection.notes()).anyMatch(n -> n.contains("Spread band ignored"));
    }

    @Test
    @DisplayName("Le filtre joueur s'appuie sur les boxscores joueurs du store")
    void playerFilterUsesStore() {
        FilterBundle filters = FilterBundle.builder().leagueCode("NBA").player("lebron").build();
        when(gameStore.findGamesWithPlayer(anyCollection(), eq("lebron"))).thenReturn(Set.of(3L, 5L));

        CohortBuilderService.CohortSelection selection = cohortBuilder.select(history, filters, TargetDefinitions.defaultTarget());

        assertThat(selection.cohortIds()).containsExactly(3L, 5L);
    }

    @Test
    @DisplayName("Portée 'current' : seule la dernière saison est conservée")
    void currentScopeKeepsLatestSeason() {
        List<GameSnapshot> twoSeasons = new ArrayList<>(GameFixtures.season(LocalDate.of(2022, 11, 1), 10, 1L, false));
        twoSeasons.addAll(GameFixtures.season(LocalDate.of(2023, 11, 1), 10, 2L, false).stream()
                .map(g -> GameFixtures.game(g.id() + 1000, g.gameDay(), g.homeTeam(), g.awayTeam(), g.homeScore(), g.awayScore()))
                .toList());
        FilterBundle filters = FilterBundle.builder().leagueCode("NBA").seasonScope(SeasonScope.CURRENT).build();

        CohortBuilderService.CohortSelection selection = cohortBuilder.select(twoSeasons, filters, TargetDefinitions.defaultTarget());

        assertThat(selection.baseline()).hasSize(20).allMatch(g -> g.season() == 2023);
    }

    @Test
    @DisplayName("Portée 'recent' : les N derniers jours jusqu'au dernier jour de match inclus")
    void recentScopeKeepsTrailingDays() {
        FilterBundle filters = FilterBundle.builder().leagueCode("NBA").seasonScope(SeasonScope.RECENT).recentDays(10).build();

        CohortBuilderService.CohortSelection selection = cohortBuilder.select(history, filters, TargetDefinitions.defaultTarget());

        LocalDate latest = LocalDate.of(2023, 11, 1).plusDays(89);
        assertThat(selection.baseline()).hasSize(20)
                .allMatch(g -> g.gameDay().isAfter(latest.minusDays(10)) && !g.gameDay().isAfter(latest));
        assertThat(selection.notes()).anyMatch(n -> n.startsWith("Season scope recent: last 10 days up to " + latest));
    }

    @Test
    @DisplayName("Phases NCAAB : début inclus, fin exclue")
    void ncaabPhaseBoundaries() {
        List<LocalDate> days = List.of(
                LocalDate.of(2023, 12, 31),
                LocalDate.of(2024, 1, 1),
                LocalDate.of(2024, 3, 15),
                LocalDate.of(2024, 3, 16),
                LocalDate.of(2024, 4, 15),
                LocalDate.of(2024, 4, 16));
        List<GameSnapshot> games = new ArrayList<>();
        for (int i = 0; i < days.size(); i++) {
            // Saison 2023 pour tous : démarre en novembre 2023
            GameSnapshot g = GameFixtures.game(i + 1, days.get(i), LAKERS, GameFixtures.CELTICS, 70, 65);
            games.add(new GameSnapshot(g.id(), 2023, g.gameDate(), g.homeTeam(), g.awayTeam(), g.homeScore(), g.awayScore(),
                    g.homeStats(), g.awayStats(), g.closingLines()));
        }

        assertThat(idsInPhase(games, GamePhase.OUT_CONF)).containsExactly(1L);
        assertThat(idsInPhase(games, GamePhase.CONF)).containsExactly(2L, 3L);
        assertThat(idsInPhase(games, GamePhase.POSTSEASON)).containsExactly(4L, 5L);
        assertThat(idsInPhase(games, GamePhase.ALL)).hasSize(6);
    }

    private List<Long> idsInPhase(List<GameSnapshot> games, GamePhase phase) {
        FilterBundle filters = FilterBundle.builder().leagueCode("NCAAB").phase(phase).build();
        return cohortBuilder.select(games, filters, TargetDefinitions.defaultTarget()).baseline().stream()
                .map(GameSnapshot::id)
                .toList();
    }
}
