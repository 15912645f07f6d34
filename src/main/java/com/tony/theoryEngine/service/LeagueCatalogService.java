package com.tony.theoryEngine.service;

import com.tony.theoryEngine.exception.TheoryConfigurationException;
import com.tony.theoryEngine.model.engine.ReasonCode;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ligues supportées et clés de stats disponibles dans leurs boxscores d'équipe.
 */
@Service
public class LeagueCatalogService {

    public record LeagueProfile(String code, String name, String level, String scoreStat,
                                List<String> statKeys, boolean phased) {
        public boolean hasStat(String key) {
            return statKeys.contains(key);
        }
    }

    private static final List<String> BASKETBALL_STATS = List.of(
            "points", "rebounds", "offensive_rebounds", "defensive_rebounds", "assists", "turnovers",
            "steals", "blocks", "fouls", "fg_pct", "fg3_pct", "ft_pct", "efg_pct", "ts_pct", "pace", "possessions");

    private static final List<String> FOOTBALL_STATS = List.of(
            "points", "total_yards", "passing_yards", "rushing_yards", "turnovers", "first_downs",
            "penalties", "penalty_yards", "sacks", "third_down_pct", "time_of_possession");

    private static final Map<String, LeagueProfile> LEAGUES = new LinkedHashMap<>();

    static {
        register(new LeagueProfile("NBA", "National Basketball Association", "pro", "points", BASKETBALL_STATS, false));
        register(new LeagueProfile("NCAAB", "NCAA Men's Basketball", "college", "points", BASKETBALL_STATS, true));
        register(new LeagueProfile("NFL", "National Football League", "pro", "points", FOOTBALL_STATS, false));
        register(new LeagueProfile("NCAAF", "NCAA Football", "college", "points", FOOTBALL_STATS, false));
        register(new LeagueProfile("MLB", "Major League Baseball", "pro", "runs", List.of(
                "runs", "hits", "errors", "home_runs", "strikeouts", "walks", "left_on_base", "batting_avg"), false));
        register(new LeagueProfile("NHL", "National Hockey League", "pro", "goals", List.of(
                "goals", "shots", "power_play_goals", "penalty_minutes", "faceoff_pct", "saves", "hits", "blocked_shots"), false));
    }

    private static void register(LeagueProfile profile) {
        LEAGUES.put(profile.code(), profile);
    }

    public Optional<LeagueProfile> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(LEAGUES.get(code.trim().toUpperCase()));
    }

    public LeagueProfile require(String code) {
        return find(code).orElseThrow(() -> new TheoryConfigurationException(
                "filters.leagueCode", ReasonCode.UNKNOWN_LEAGUE,
                "Ligue inconnue : '" + code + "'. Ligues supportées : " + String.join(", ", LEAGUES.keySet())));
    }

    public List<LeagueProfile> all() {
        return List.copyOf(LEAGUES.values());
    }
}
