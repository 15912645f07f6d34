package com.tony.theoryEngine.service;

import com.tony.theoryEngine.exception.TheoryConfigurationException;
import com.tony.theoryEngine.model.dto.FeatureGenerationRequest;
import com.tony.theoryEngine.model.dto.FeatureGenerationResponse;
import com.tony.theoryEngine.model.dto.GeneratedFeature;
import com.tony.theoryEngine.model.engine.FeatureCategory;
import com.tony.theoryEngine.model.engine.FeatureKind;
import com.tony.theoryEngine.model.engine.FeatureTiming;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureGeneratorServiceTest {

    private final LeagueCatalogService catalog = new LeagueCatalogService();
    private final FeatureGeneratorService generator = new FeatureGeneratorService(catalog);

    @Test
    @DisplayName("Quatre features brutes par stat, repos et moyennes glissantes en option")
    void generatesFeatureFamilies() {
        FeatureGenerationRequest request = FeatureGenerationRequest.builder()
                .leagueCode("nba")
                .rawStats(List.of("points", "Rebounds", "points", "yards"))
                .includeRestDays(true)
                .includeRolling(true)
                .rollingWindow(50)
                .build();

        FeatureGenerationResponse response = generator.generate(request);

        assertThat(response.getLeagueCode()).isEqualTo("NBA");
        assertThat(response.getRollingWindow()).isEqualTo(FeatureGeneratorService.MAX_ROLLING_WINDOW);
        assertThat(response.getSkippedStats()).containsExactly("yards");
        // 2 stats x 4 + 3 repos + 2 stats x 3 glissantes
        assertThat(response.getFeatures()).hasSize(17);
        assertThat(response.getFeatures()).extracting(GeneratedFeature::getName)
                .startsWith("home_points", "away_points", "points_diff", "total_points")
                .contains("rest_advantage", "rolling_rebounds_20_diff");
        assertThat(response.getSummary()).contains("skipped unknown stats: yards");
    }

    @Test
    @DisplayName("Les features brutes sont post-match, les glissantes et le repos pré-match")
    void timingOfFeatures() {
        FeatureGenerationResponse response = generator.generate(FeatureGenerationRequest.builder()
                .leagueCode("NFL").rawStats(List.of("total_yards")).includeRolling(true).includeRestDays(true).build());

        assertThat(response.getFeatures())
                .filteredOn(f -> f.getCategory() == FeatureCategory.RAW || f.getCategory() == FeatureCategory.DIFFERENTIAL)
                .allMatch(f -> f.getTiming() == FeatureTiming.POST_GAME);
        assertThat(response.getFeatures())
                .filteredOn(f -> f.getCategory() == FeatureCategory.ROLLING || f.getCategory() == FeatureCategory.SITUATIONAL)
                .allMatch(f -> f.getTiming() == FeatureTiming.PRE_GAME);
    }

    @Test
    @DisplayName("Parsing : \"total_yards_diff\" est le différentiel de total_yards")
    void parsesAmbiguousNames() {
        LeagueCatalogService.LeagueProfile nfl = catalog.require("NFL");

        assertThat(generator.parse("total_yards_diff", nfl)).hasValueSatisfying(def -> {
            assertThat(def.kind()).isEqualTo(FeatureKind.DIFF);
            assertThat(def.stat()).isEqualTo("total_yards");
        });
        assertThat(generator.parse("total_total_yards", nfl)).hasValueSatisfying(def ->
                assertThat(def.kind()).isEqualTo(FeatureKind.TOTAL));
        assertThat(generator.parse("rolling_points_1_home", nfl)).isEmpty();
        assertThat(generator.parse("home_rebounds", nfl)).isEmpty();
    }

    @Test
    @DisplayName("Groupes de signal déduits du nom de la stat")
    void infersGroups() {
        assertThat(FeatureGeneratorService.inferGroup("fg3_pct")).isEqualTo("efficiency");
        assertThat(FeatureGeneratorService.inferGroup("offensive_rebounds")).isEqualTo("rebounding");
        assertThat(FeatureGeneratorService.inferGroup("turnovers")).isEqualTo("discipline");
        assertThat(FeatureGeneratorService.inferGroup("possessions")).isEqualTo("pace");
        assertThat(FeatureGeneratorService.inferGroup("points")).isEqualTo("scoring");
        assertThat(FeatureGeneratorService.inferGroup("blocks")).isEqualTo("other");
    }

    @Test
    @DisplayName("Ligue inconnue : exception de configuration")
    void unknownLeague() {
        assertThatThrownBy(() -> generator.generate(FeatureGenerationRequest.builder().leagueCode("XFL").build()))
                .isInstanceOf(TheoryConfigurationException.class)
                .hasMessageContaining("XFL");
    }
}
