package com.tony.theoryEngine.config;

import com.tony.theoryEngine.model.League;
import com.tony.theoryEngine.repository.LeagueRepository;
import com.tony.theoryEngine.service.LeagueCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class DataInitializer implements CommandLineRunner {

    private final LeagueRepository leagueRepository;
    private final LeagueCatalogService leagueCatalog;

    @Override
    public void run(String... args) {
        // On ne remplit que si la table est vide
        if (leagueRepository.count() > 0) {
            return;
        }
        log.info("🌱 Initialisation du catalogue des ligues...");
        List<League> leagues = leagueCatalog.all().stream()
                .map(profile -> new League(profile.code(), profile.name(), profile.level()))
                .toList();
        leagueRepository.saveAll(leagues);
        log.info("✅ {} ligues initialisées", leagues.size());
    }
}
