package com.tony.theoryEngine.repository;

import com.tony.theoryEngine.model.TeamBoxscore;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface TeamBoxscoreRepository extends JpaRepository<TeamBoxscore, Long> {
    List<TeamBoxscore> findByGameIdIn(Collection<Long> gameIds);
}
