package com.tony.theoryEngine.controller;

import com.tony.theoryEngine.model.dto.LeagueReference;
import com.tony.theoryEngine.model.engine.GamePhase;
import com.tony.theoryEngine.service.HistoricalGameStore;
import com.tony.theoryEngine.service.LeagueCatalogService;
import com.tony.theoryEngine.service.LeagueCatalogService.LeagueProfile;
import com.tony.theoryEngine.service.TargetDefinitions;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/v1/references")
@RequiredArgsConstructor
public class ReferenceController {

    private final LeagueCatalogService leagueCatalog;
    private final HistoricalGameStore gameStore;

    @GetMapping("/leagues")
    public ResponseEntity<List<LeagueReference>> getAllLeagues() {
        return ResponseEntity.ok(leagueCatalog.all().stream()
                .map(league -> toReference(league, null))
                .toList());
    }

    // Détail d'une ligue, avec les saisons présentes en base
    @GetMapping("/leagues/{code}")
    public ResponseEntity<LeagueReference> getLeague(@PathVariable String code) {
        LeagueProfile league = leagueCatalog.require(code);
        return ResponseEntity.ok(toReference(league, gameStore.listSeasons(league.code())));
    }

    private static LeagueReference toReference(LeagueProfile league, List<Integer> seasons) {
        return LeagueReference.builder()
                .code(league.code())
                .name(league.name())
                .level(league.level())
                .statKeys(league.statKeys())
                .statTargets(TargetDefinitions.STAT_TARGETS)
                .phases(league.phased() ? Arrays.asList(GamePhase.values()) : List.of(GamePhase.ALL))
                .seasons(seasons)
                .build();
    }
}
