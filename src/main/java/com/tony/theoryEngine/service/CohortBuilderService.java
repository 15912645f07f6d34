package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.FilterBundle;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.ClosingLine;
import com.tony.theoryEngine.model.engine.GamePhase;
import com.tony.theoryEngine.model.engine.GameSnapshot;
import com.tony.theoryEngine.model.engine.MarketType;
import com.tony.theoryEngine.model.engine.SeasonScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Population de référence (ligue + périmètre temporel) et cohorte (population + filtres de la théorie).
 * La cohorte est toujours extraite de la population, jamais rechargée à part.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CohortBuilderService {

    private final HistoricalGameStore gameStore;

    public record CohortSelection(List<GameSnapshot> baseline, Set<Long> cohortIds, List<String> notes) {

        public List<GameSnapshot> cohort() {
            return baseline.stream().filter(g -> cohortIds.contains(g.id())).toList();
        }
    }

    public CohortSelection select(List<GameSnapshot> history, FilterBundle filters, TargetDefinition target) {
        List<String> notes = new ArrayList<>();
        List<GameSnapshot> baseline = applyScope(history, filters, notes);

        List<GameSnapshot> cohort = baseline;
        if (filters.getTeam() != null) {
            String team = filters.getTeam();
            cohort = cohort.stream()
                    .filter(g -> g.homeTeam().matches(team) || g.awayTeam().matches(team))
                    .toList();
            notes.add("Team filter '" + team + "': " + cohort.size() + " games");
        }
        if (filters.getPlayer() != null && !cohort.isEmpty()) {
            Set<Long> withPlayer = gameStore.findGamesWithPlayer(
                    cohort.stream().map(GameSnapshot::id).toList(), filters.getPlayer());
            cohort = cohort.stream().filter(g -> withPlayer.contains(g.id())).toList();
            notes.add("Player filter '" + filters.getPlayer() + "': " + cohort.size() + " games");
        }
        if (hasSpreadBand(filters)) {
            if (target.isMarket() && target.getMarketType() == MarketType.SPREAD) {
                cohort = cohort.stream().filter(g -> inSpreadBand(g, filters)).toList();
                notes.add("Spread band filter: " + cohort.size() + " games");
            } else {
                notes.add("Spread band ignored: only applies to spread market targets");
            }
        }

        Set<Long> cohortIds = cohort.stream().map(GameSnapshot::id).collect(Collectors.toCollection(LinkedHashSet::new));
        log.info("🎯 [{}] Population : {} matchs, cohorte : {} matchs", filters.getLeagueCode(), baseline.size(), cohortIds.size());
        return new CohortSelection(baseline, cohortIds, notes);
    }

    /**
     * Périmètre commun à la population et à la cohorte : saisons, phase, dates.
     */
    List<GameSnapshot> applyScope(List<GameSnapshot> history, FilterBundle filters, List<String> notes) {
        List<GameSnapshot> scoped = history;
        if (!filters.getSeasons().isEmpty()) {
            Set<Integer> seasons = Set.copyOf(filters.getSeasons());
            scoped = scoped.stream().filter(g -> seasons.contains(g.season())).toList();
        }
        if (scoped.isEmpty()) {
            return scoped;
        }

        if (filters.getSeasonScope() == SeasonScope.CURRENT) {
            int current = scoped.stream().mapToInt(GameSnapshot::season).max().getAsInt();
            scoped = scoped.stream().filter(g -> g.season() == current).toList();
            notes.add("Season scope current: season " + current);
        } else if (filters.getSeasonScope() == SeasonScope.RECENT) {
            LocalDate latest = scoped.stream().map(GameSnapshot::gameDay).max(LocalDate::compareTo).get();
            LocalDate from = latest.minusDays(filters.getRecentDays());
            scoped = scoped.stream().filter(g -> g.gameDay().isAfter(from)).toList();
            notes.add("Season scope recent: last " + filters.getRecentDays() + " days up to " + latest);
        }

        GamePhase phase = filters.getPhase();
        if (phase != null && phase != GamePhase.ALL) {
            scoped = scoped.stream().filter(g -> phase.contains(g.gameDay(), g.season())).toList();
            notes.add("Phase " + phase.getCode() + ": " + scoped.size() + " games");
        }
        if (filters.getDateStart() != null) {
            scoped = scoped.stream().filter(g -> !g.gameDay().isBefore(filters.getDateStart())).toList();
        }
        if (filters.getDateEnd() != null) {
            scoped = scoped.stream().filter(g -> !g.gameDay().isAfter(filters.getDateEnd())).toList();
        }
        return scoped;
    }

    static boolean hasSpreadBand(FilterBundle filters) {
        return filters.getSpreadMin() != null || filters.getSpreadMax() != null;
    }

    static boolean inSpreadBand(GameSnapshot game, FilterBundle filters) {
        Optional<Double> line = homeSpread(game);
        if (line.isEmpty()) {
            return false;
        }
        double abs = Math.abs(line.get());
        return (filters.getSpreadMin() == null || abs >= filters.getSpreadMin())
                && (filters.getSpreadMax() == null || abs <= filters.getSpreadMax());
    }

    static Optional<Double> homeSpread(GameSnapshot game) {
        Optional<Double> home = game.closingLine(MarketType.SPREAD, "home").map(ClosingLine::line);
        if (home.isPresent()) {
            return home;
        }
        return game.closingLine(MarketType.SPREAD, "away").map(ClosingLine::line).map(l -> -l);
    }
}
