package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.GameSnapshot;
import com.tony.theoryEngine.util.NumericValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calcule les valeurs des features par match. Les features roulantes et de repos d'un match
 * ne lisent que les matchs de l'équipe joués à une date strictement antérieure.
 */
@Slf4j
@Service
public class FeatureComputationService {

    private record TeamGame(LocalDate day, int season, Map<String, Object> stats) {
    }

    public Map<Long, Map<String, Object>> compute(List<GameSnapshot> history, List<GameSnapshot> targets,
                                                  List<FeatureDefinition> features) {
        Map<Long, Map<String, Object>> result = new LinkedHashMap<>();
        if (targets.isEmpty()) {
            return result;
        }
        if (features.isEmpty()) {
            targets.forEach(g -> result.put(g.id(), new LinkedHashMap<>()));
            return result;
        }

        boolean needsHistory = features.stream().anyMatch(f -> f.isRolling() || f.isRest());
        Map<Long, List<TeamGame>> index = needsHistory ? buildIndex(history) : Map.of();

        // Index en lecture seule : le calcul par match est parallélisable, l'ordre est préservé par toList()
        List<Map<String, Object>> rows = targets.parallelStream()
                .map(g -> computeRow(g, features, index))
                .toList();
        for (int i = 0; i < targets.size(); i++) {
            result.put(targets.get(i).id(), rows.get(i));
        }
        log.debug("Features calculées : {} matchs x {} features", targets.size(), features.size());
        return result;
    }

    private Map<Long, List<TeamGame>> buildIndex(List<GameSnapshot> history) {
        Map<Long, List<TeamGame>> index = new HashMap<>();
        List<GameSnapshot> sorted = new ArrayList<>(history);
        sorted.sort(GameSnapshot.CHRONOLOGICAL);
        for (GameSnapshot g : sorted) {
            index.computeIfAbsent(g.homeTeam().id(), k -> new ArrayList<>())
                    .add(new TeamGame(g.gameDay(), g.season(), g.homeStats()));
            index.computeIfAbsent(g.awayTeam().id(), k -> new ArrayList<>())
                    .add(new TeamGame(g.gameDay(), g.season(), g.awayStats()));
        }
        return index;
    }

    private Map<String, Object> computeRow(GameSnapshot game, List<FeatureDefinition> features,
                                           Map<Long, List<TeamGame>> index) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (FeatureDefinition f : features) {
            row.put(f.name(), value(game, f, index));
        }
        return row;
    }

    private Object value(GameSnapshot game, FeatureDefinition f, Map<Long, List<TeamGame>> index) {
        return switch (f.kind()) {
            case RAW_HOME -> game.homeStats().get(f.stat());
            case RAW_AWAY -> game.awayStats().get(f.stat());
            case DIFF -> combine(game.homeStats().get(f.stat()), game.awayStats().get(f.stat()), -1);
            case TOTAL -> combine(game.homeStats().get(f.stat()), game.awayStats().get(f.stat()), 1);
            case REST_HOME -> restDays(game, true, index);
            case REST_AWAY -> restDays(game, false, index);
            case REST_ADVANTAGE -> subtract(restDays(game, true, index), restDays(game, false, index));
            case ROLLING_HOME -> rolling(game, true, f, index);
            case ROLLING_AWAY -> rolling(game, false, f, index);
            case ROLLING_DIFF -> subtract(rolling(game, true, f, index), rolling(game, false, f, index));
        };
    }

    private static Double combine(Object home, Object away, int sign) {
        Double h = NumericValues.toDouble(home);
        Double a = NumericValues.toDouble(away);
        if (h == null || a == null) {
            return null;
        }
        return h + sign * a;
    }

    private static Double subtract(Double a, Double b) {
        return a == null || b == null ? null : a - b;
    }

    private Double restDays(GameSnapshot game, boolean home, Map<Long, List<TeamGame>> index) {
        List<TeamGame> games = index.getOrDefault(game.team(home).id(), List.of());
        int end = firstOnOrAfter(games, game.gameDay());
        if (end == 0) {
            return null;
        }
        TeamGame previous = games.get(end - 1);
        if (previous.season() != game.season()) {
            return null;
        }
        return (double) ChronoUnit.DAYS.between(previous.day(), game.gameDay());
    }

    private Double rolling(GameSnapshot game, boolean home, FeatureDefinition f, Map<Long, List<TeamGame>> index) {
        List<TeamGame> games = index.getOrDefault(game.team(home).id(), List.of());
        int end = firstOnOrAfter(games, game.gameDay());
        int start = Math.max(0, end - f.window());
        double sum = 0;
        int count = 0;
        for (int i = start; i < end; i++) {
            Double v = NumericValues.toDouble(games.get(i).stats().get(f.stat()));
            if (v != null) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    // Premier index dont la date est >= day (liste triée chronologiquement)
    private static int firstOnOrAfter(List<TeamGame> games, LocalDate day) {
        int lo = 0;
        int hi = games.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (games.get(mid).day().isBefore(day)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
