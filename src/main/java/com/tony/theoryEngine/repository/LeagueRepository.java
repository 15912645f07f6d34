package com.tony.theoryEngine.repository;

import com.tony.theoryEngine.model.League;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface LeagueRepository extends JpaRepository<League, Long> {
    Optional<League> findByCodeIgnoreCase(String code);
}
