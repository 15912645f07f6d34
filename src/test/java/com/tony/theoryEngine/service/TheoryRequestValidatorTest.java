package com.tony.theoryEngine.service;

import com.tony.theoryEngine.exception.TheoryConfigurationException;
import com.tony.theoryEngine.model.dto.ExposureControls;
import com.tony.theoryEngine.model.dto.FilterBundle;
import com.tony.theoryEngine.model.dto.GeneratedFeature;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.dto.WalkforwardWindow;
import com.tony.theoryEngine.model.engine.AnalysisContext;
import com.tony.theoryEngine.model.engine.FeatureKind;
import com.tony.theoryEngine.model.engine.GamePhase;
import com.tony.theoryEngine.model.engine.MarketType;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.model.engine.SeasonScope;
import com.tony.theoryEngine.model.engine.TargetClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TheoryRequestValidatorTest {

    private final LeagueCatalogService catalog = new LeagueCatalogService();
    private final TheoryRequestValidator validator = new TheoryRequestValidator(catalog, new FeatureGeneratorService(catalog));

    private static FilterBundle nba() {
        return FilterBundle.builder().leagueCode("NBA").build();
    }

    private static List<GeneratedFeature> named(String... names) {
        return Arrays.stream(names).map(n -> GeneratedFeature.builder().name(n).build()).toList();
    }

    private ResolvedTheory resolve(FilterBundle filters, List<GeneratedFeature> features, TargetDefinition target) {
        return validator.resolve(filters, features, target, null, null, null, null, null);
    }

    @Test
    @DisplayName("Valeurs par défaut : cible combined_score, contexte deployable, pas de nettoyage")
    void appliesDefaults() {
        ResolvedTheory theory = resolve(nba(), null, null);

        assertThat(theory.target().getTargetName()).isEqualTo(TargetDefinitions.COMBINED_SCORE);
        assertThat(theory.context()).isEqualTo(AnalysisContext.DEPLOYABLE);
        assertThat(theory.trigger().getProbThreshold()).isEqualTo(0.55);
        assertThat(theory.exposure().getMaxBetsPerDay()).isEqualTo(5);
        assertThat(theory.features()).isEmpty();
        assertThat(theory.window()).isNull();
    }

    @Test
    @DisplayName("Normalisation des filtres : saisons triées et dédoublonnées, équipe en minuscules")
    void normalizesFilters() {
        FilterBundle filters = FilterBundle.builder()
                .leagueCode(" nba ")
                .seasons(List.of(2023, 2021, 2023))
                .seasonScope(SeasonScope.RECENT)
                .team("  Lakers ")
                .phase(GamePhase.POSTSEASON)
                .build();

        FilterBundle normalized = resolve(filters, null, null).filters();

        assertThat(normalized.getLeagueCode()).isEqualTo("NBA");
        assertThat(normalized.getSeasons()).containsExactly(2021, 2023);
        assertThat(normalized.getRecentDays()).isEqualTo(TheoryRequestValidator.DEFAULT_RECENT_DAYS);
        assertThat(normalized.getTeam()).isEqualTo("lakers");
        // Les phases ne concernent que NCAAB
        assertThat(normalized.getPhase()).isEqualTo(GamePhase.ALL);
    }

    @Test
    @DisplayName("Ligue inconnue : unknown_league")
    void unknownLeague() {
        assertThatThrownBy(() -> resolve(FilterBundle.builder().leagueCode("XFL").build(), null, null))
                .isInstanceOf(TheoryConfigurationException.class)
                .extracting("reasonCode").isEqualTo(ReasonCode.UNKNOWN_LEAGUE);
    }

    @Test
    @DisplayName("Feature inconnue ou en double : rejet avec le champ fautif")
    void unknownOrDuplicateFeature() {
        assertThatThrownBy(() -> resolve(nba(), named("rolling_points_5_home", "rolling_yards_5_home"), null))
                .isInstanceOf(TheoryConfigurationException.class)
                .hasFieldOrPropertyWithValue("field", "features[1].name")
                .hasFieldOrPropertyWithValue("reasonCode", ReasonCode.UNKNOWN_FEATURE);
        assertThatThrownBy(() -> resolve(nba(), named("home_points", "home_points"), null))
                .isInstanceOf(TheoryConfigurationException.class)
                .hasMessageContaining("double");
    }

    @Test
    @DisplayName("Features reconnues dans l'ordre de la requête")
    void resolvesFeatures() {
        ResolvedTheory theory = resolve(nba(), named("rest_advantage", "rolling_rebounds_10_diff", "points_diff"), null);

        assertThat(theory.features()).extracting(f -> f.kind())
                .containsExactly(FeatureKind.REST_ADVANTAGE, FeatureKind.ROLLING_DIFF, FeatureKind.DIFF);
        assertThat(theory.features().get(1).window()).isEqualTo(10);
    }

    @Test
    @DisplayName("Côté invalide pour le marché")
    void badMarketSide() {
        TargetDefinition target = TargetDefinition.builder()
                .targetClass(TargetClass.MARKET).targetName("spread").marketType(MarketType.SPREAD).side("over").build();

        assertThatThrownBy(() -> resolve(nba(), null, target))
                .isInstanceOf(TheoryConfigurationException.class)
                .hasFieldOrPropertyWithValue("field", "target.side");
    }

    @Test
    @DisplayName("Cible stat : type de métrique incohérent rejeté")
    void statMetricTypeMismatch() {
        TargetDefinition target = TargetDefinition.builder()
                .targetClass(TargetClass.STAT).targetName("home_win").metricType(MetricType.NUMERIC).build();

        assertThatThrownBy(() -> resolve(nba(), null, target))
                .isInstanceOf(TheoryConfigurationException.class)
                .hasFieldOrPropertyWithValue("field", "target.metricType");
    }

    @Test
    @DisplayName("Bande de spread inversée rejetée, dans les filtres comme dans l'exposition")
    void spreadBandOrder() {
        FilterBundle filters = FilterBundle.builder().leagueCode("NBA").spreadMin(7.0).spreadMax(3.0).build();
        assertThatThrownBy(() -> resolve(filters, null, null))
                .isInstanceOf(TheoryConfigurationException.class)
                .hasFieldOrPropertyWithValue("field", "filters.spreadMin");

        ExposureControls exposure = ExposureControls.builder().spreadAbsMin(7.0).spreadAbsMax(3.0).build();
        assertThatThrownBy(() -> validator.resolve(nba(), null, null, null, exposure, null, null, null))
                .isInstanceOf(TheoryConfigurationException.class)
                .hasFieldOrPropertyWithValue("field", "exposure.spreadAbsMax");
    }

    @Test
    @DisplayName("Fenêtre walk-forward hors bornes")
    void windowBounds() {
        WalkforwardWindow tooShort = WalkforwardWindow.builder().trainDays(10).build();
        WalkforwardWindow tooLongTest = WalkforwardWindow.builder().testDays(120).build();

        assertThatThrownBy(() -> validator.resolve(nba(), null, null, null, null, null, null, tooShort))
                .hasFieldOrPropertyWithValue("field", "window.trainDays");
        assertThatThrownBy(() -> validator.resolve(nba(), null, null, null, null, null, null, tooLongTest))
                .hasFieldOrPropertyWithValue("field", "window.testDays");
        assertThat(validator.resolve(nba(), null, null, null, null, null, null, new WalkforwardWindow()).window())
                .isNotNull();
    }
}
