package com.tony.theoryEngine.repository;

import com.tony.theoryEngine.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface GameRepository extends JpaRepository<Game, Long> {

    // Uniquement les matchs joués, ordre chronologique stable (date puis id)
    @Query("SELECT g FROM Game g WHERE g.league.id = :leagueId " +
            "AND g.season IN :seasons " +
            "AND g.homeScore IS NOT NULL AND g.awayScore IS NOT NULL " +
            "ORDER BY g.gameDate ASC, g.id ASC")
    List<Game> findCompletedByLeagueAndSeasons(@Param("leagueId") Long leagueId,
                                               @Param("seasons") Collection<Integer> seasons);

    @Query("SELECT g FROM Game g WHERE g.league.id = :leagueId " +
            "AND g.homeScore IS NOT NULL AND g.awayScore IS NOT NULL " +
            "ORDER BY g.gameDate ASC, g.id ASC")
    List<Game> findCompletedByLeague(@Param("leagueId") Long leagueId);

    @Query("SELECT DISTINCT g.season FROM Game g WHERE g.league.id = :leagueId ORDER BY g.season ASC")
    List<Integer> findSeasonsByLeague(@Param("leagueId") Long leagueId);
}
