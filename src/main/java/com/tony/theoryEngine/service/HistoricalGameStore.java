package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.exception.UpstreamUnavailableException;
import com.tony.theoryEngine.model.Game;
import com.tony.theoryEngine.model.GameOdds;
import com.tony.theoryEngine.model.League;
import com.tony.theoryEngine.model.Team;
import com.tony.theoryEngine.model.TeamBoxscore;
import com.tony.theoryEngine.model.engine.ClosingLine;
import com.tony.theoryEngine.model.engine.GameSnapshot;
import com.tony.theoryEngine.model.engine.TeamRef;
import com.tony.theoryEngine.repository.GameOddsRepository;
import com.tony.theoryEngine.repository.GameRepository;
import com.tony.theoryEngine.repository.LeagueRepository;
import com.tony.theoryEngine.repository.PlayerBoxscoreRepository;
import com.tony.theoryEngine.repository.TeamBoxscoreRepository;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Accès en lecture seule aux matchs, boxscores et cotes de clôture.
 * Seule frontière du moteur où les pannes de la base sont rejouées.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoricalGameStore {

    private final LeagueRepository leagueRepository;
    private final GameRepository gameRepository;
    private final TeamBoxscoreRepository teamBoxscoreRepository;
    private final PlayerBoxscoreRepository playerBoxscoreRepository;
    private final GameOddsRepository gameOddsRepository;
    private final Retry gameStoreRetry;
    private final TheoryEngineProperties properties;

    /**
     * Matchs joués de la ligue, ordre chronologique. Saisons vides = toutes les saisons.
     */
    public List<GameSnapshot> loadCompletedGames(String leagueCode, Collection<Integer> seasons) {
        Optional<League> league = withRetry("league", () -> leagueRepository.findByCodeIgnoreCase(leagueCode));
        if (league.isEmpty()) {
            log.warn("⚠️ Ligue {} absente du Historical Game Store", leagueCode);
            return List.of();
        }
        Long leagueId = league.get().getId();
        List<Game> games = withRetry("games", () -> seasons == null || seasons.isEmpty()
                ? gameRepository.findCompletedByLeague(leagueId)
                : gameRepository.findCompletedByLeagueAndSeasons(leagueId, seasons));
        if (games.isEmpty()) {
            return List.of();
        }

        List<Long> ids = games.stream().map(Game::getId).toList();
        List<TeamBoxscore> boxscores = inChunks(ids, chunk -> withRetry("boxscores", () -> teamBoxscoreRepository.findByGameIdIn(chunk)));
        List<GameOdds> odds = inChunks(ids, chunk -> withRetry("odds", () -> gameOddsRepository.findByGameIdInAndClosingLineTrue(chunk)));

        Map<String, Map<String, Object>> statsByGameTeam = new HashMap<>();
        for (TeamBoxscore box : boxscores) {
            statsByGameTeam.put(box.getGameId() + ":" + box.getTeamId(), box.getStats() == null ? Map.of() : box.getStats());
        }
        Map<Long, List<ClosingLine>> linesByGame = new HashMap<>();
        for (GameOdds o : odds) {
            linesByGame.computeIfAbsent(o.getGameId(), k -> new ArrayList<>())
                    .add(new ClosingLine(lower(o.getMarketType()), lower(o.getSide()), o.getLine(), o.getPrice(), o.getBook()));
        }

        List<GameSnapshot> snapshots = games.stream()
                .map(g -> new GameSnapshot(
                        g.getId(),
                        g.getSeason(),
                        g.getGameDate(),
                        toRef(g.getHomeTeam()),
                        toRef(g.getAwayTeam()),
                        g.getHomeScore(),
                        g.getAwayScore(),
                        statsByGameTeam.getOrDefault(g.getId() + ":" + g.getHomeTeam().getId(), Map.of()),
                        statsByGameTeam.getOrDefault(g.getId() + ":" + g.getAwayTeam().getId(), Map.of()),
                        List.copyOf(linesByGame.getOrDefault(g.getId(), List.of()))))
                .sorted(GameSnapshot.CHRONOLOGICAL)
                .toList();

        log.info("📦 [{}] {} matchs chargés ({} boxscores, {} lignes de clôture)", leagueCode, snapshots.size(), boxscores.size(), odds.size());
        return snapshots;
    }

    public Set<Long> findGamesWithPlayer(Collection<Long> gameIds, String player) {
        if (gameIds.isEmpty() || player == null || player.isBlank()) {
            return Set.of();
        }
        List<Long> ids = List.copyOf(gameIds);
        return new HashSet<>(inChunks(ids, chunk ->
                withRetry("players", () -> playerBoxscoreRepository.findGameIdsWithPlayer(chunk, player.trim()))));
    }

    public List<Integer> listSeasons(String leagueCode) {
        return withRetry("seasons", () -> leagueRepository.findByCodeIgnoreCase(leagueCode)
                .map(l -> gameRepository.findSeasonsByLeague(l.getId()))
                .orElse(List.of()));
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(gameStoreRetry, call).get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.error("❌ Historical Game Store indisponible après {} tentatives ({})",
                    gameStoreRetry.getRetryConfig().getMaxAttempts(), operation);
            throw new UpstreamUnavailableException("Historical Game Store indisponible (" + operation + ")", e);
        }
    }

    private <T> List<T> inChunks(List<Long> ids, Function<List<Long>, List<T>> loader) {
        int size = Math.max(1, properties.getStore().getQueryChunkSize());
        List<T> all = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += size) {
            all.addAll(loader.apply(ids.subList(from, Math.min(ids.size(), from + size))));
        }
        return all;
    }

    private static TeamRef toRef(Team team) {
        return new TeamRef(team.getId(), team.getName(), team.getShortName(), team.getAbbreviation());
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase();
    }
}
