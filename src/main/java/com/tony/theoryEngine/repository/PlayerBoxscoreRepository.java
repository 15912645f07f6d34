package com.tony.theoryEngine.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import com.tony.theoryEngine.model.PlayerBoxscore;

import java.util.Collection;
import java.util.List;

public interface PlayerBoxscoreRepository extends JpaRepository<PlayerBoxscore, Long> {

    // Recherche par sous-chaîne, insensible à la casse
    @Query("SELECT DISTINCT p.gameId FROM PlayerBoxscore p WHERE p.gameId IN :gameIds " +
            "AND LOWER(p.playerName) LIKE LOWER(CONCAT('%', :player, '%'))")
    List<Long> findGameIdsWithPlayer(@Param("gameIds") Collection<Long> gameIds, @Param("player") String player);
}
