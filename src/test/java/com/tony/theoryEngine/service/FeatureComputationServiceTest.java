package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.FeatureKind;
import com.tony.theoryEngine.model.engine.GameSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.tony.theoryEngine.service.GameFixtures.CELTICS;
import static com.tony.theoryEngine.service.GameFixtures.KNICKS;
import static com.tony.theoryEngine.service.GameFixtures.LAKERS;
import static com.tony.theoryEngine.service.GameFixtures.WARRIORS;
import static com.tony.theoryEngine.service.GameFixtures.game;
import static org.assertj.core.api.Assertions.assertThat;

class FeatureComputationServiceTest {

    private final FeatureComputationService service = new FeatureComputationService();

    private static final List<FeatureDefinition> PRE_GAME = List.of(
            new FeatureDefinition("rolling_points_3_home", FeatureKind.ROLLING_HOME, "points", 3),
            new FeatureDefinition("rolling_points_3_away", FeatureKind.ROLLING_AWAY, "points", 3),
            new FeatureDefinition("rolling_points_3_diff", FeatureKind.ROLLING_DIFF, "points", 3),
            new FeatureDefinition("home_rest_days", FeatureKind.REST_HOME, null, 0),
            new FeatureDefinition("away_rest_days", FeatureKind.REST_AWAY, null, 0),
            new FeatureDefinition("rest_advantage", FeatureKind.REST_ADVANTAGE, null, 0));

    @Test
    @DisplayName("La moyenne glissante n'utilise que les matchs strictement antérieurs")
    void rollingUsesOnlyPriorGames() {
        LocalDate d = LocalDate.of(2023, 11, 1);
        List<GameSnapshot> history = List.of(
                game(1, d, LAKERS, CELTICS, 100, 90),
                game(2, d.plusDays(2), LAKERS, WARRIORS, 110, 90),
                game(3, d.plusDays(4), KNICKS, LAKERS, 90, 120),
                game(4, d.plusDays(7), LAKERS, KNICKS, 130, 80));

        Map<Long, Map<String, Object>> features = service.compute(history, List.of(history.get(3)), PRE_GAME);
        Map<String, Object> row = features.get(4L);

        // 3 derniers matchs des Lakers : 100, 110, 120 ; le match du jour (130) est exclu
        assertThat((Double) row.get("rolling_points_3_home")).isEqualTo(110.0);
        assertThat((Double) row.get("home_rest_days")).isEqualTo(3.0);
        assertThat((Double) row.get("away_rest_days")).isEqualTo(3.0);
        assertThat((Double) row.get("rest_advantage")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Modifier les matchs futurs ne change aucune feature pré-match")
    void futureGamesDoNotLeakIntoPreGameFeatures() {
        List<GameSnapshot> history = GameFixtures.season(LocalDate.of(2023, 11, 1), 60, 7L, false);
        LocalDate cutoff = LocalDate.of(2023, 12, 1);
        List<GameSnapshot> targets = history.stream().filter(g -> !g.gameDay().isAfter(cutoff)).toList();

        Map<Long, Map<String, Object>> before = service.compute(history, targets, PRE_GAME);

        // On remplace tout ce qui suit la date limite par des valeurs aberrantes
        Random rng = new Random(99);
        List<GameSnapshot> tampered = new ArrayList<>();
        for (GameSnapshot g : history) {
            if (g.gameDay().isAfter(cutoff)) {
                tampered.add(game(g.id(), g.gameDay(), g.homeTeam(), g.awayTeam(),
                        g.homeScore(), g.awayScore(), GameFixtures.stats(5000 + rng.nextInt(1000)),
                        GameFixtures.stats(9000 + rng.nextInt(1000))));
            } else {
                tampered.add(g);
            }
        }
        Collections.shuffle(tampered, rng);

        Map<Long, Map<String, Object>> after = service.compute(tampered, targets, PRE_GAME);
        assertThat(after).isEqualTo(before);
    }

    @Test
    @DisplayName("Les jours de repos ne traversent pas deux saisons")
    void restDaysResetAcrossSeasons() {
        GameSnapshot lastOfSeason = game(1, LocalDate.of(2023, 4, 10), LAKERS, CELTICS, 100, 95);
        GameSnapshot firstOfNext = game(2, LocalDate.of(2023, 10, 25), LAKERS, CELTICS, 101, 99);

        Map<String, Object> row = service.compute(List.of(lastOfSeason, firstOfNext), List.of(firstOfNext), PRE_GAME).get(2L);

        assertThat(row.get("home_rest_days")).isNull();
        assertThat(row.get("rest_advantage")).isNull();
    }

    @Test
    @DisplayName("Sans features, chaque match a une ligne vide")
    void noFeaturesGivesEmptyRows() {
        GameSnapshot g = game(1, LocalDate.of(2023, 11, 1), LAKERS, CELTICS, 100, 95);
        assertThat(service.compute(List.of(g), List.of(g), List.of()).get(1L)).isEmpty();
    }
}
