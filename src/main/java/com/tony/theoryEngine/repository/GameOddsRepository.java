package com.tony.theoryEngine.repository;

import com.tony.theoryEngine.model.GameOdds;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface GameOddsRepository extends JpaRepository<GameOdds, Long> {
    List<GameOdds> findByGameIdInAndClosingLineTrue(Collection<Long> gameIds);
}
