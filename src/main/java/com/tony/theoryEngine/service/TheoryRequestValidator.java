package com.tony.theoryEngine.service;

import com.tony.theoryEngine.exception.TheoryConfigurationException;
import com.tony.theoryEngine.model.dto.CleaningOptions;
import com.tony.theoryEngine.model.dto.ExposureControls;
import com.tony.theoryEngine.model.dto.FilterBundle;
import com.tony.theoryEngine.model.dto.GeneratedFeature;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.dto.TriggerDefinition;
import com.tony.theoryEngine.model.dto.WalkforwardWindow;
import com.tony.theoryEngine.model.engine.AnalysisContext;
import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.GamePhase;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.OddsAssumption;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.model.engine.SeasonScope;
import com.tony.theoryEngine.service.LeagueCatalogService.LeagueProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rejette les requêtes mal formées avant tout accès au Historical Game Store,
 * et normalise ce qui entre dans le hash du snapshot.
 */
@Service
@RequiredArgsConstructor
public class TheoryRequestValidator {

    public static final int DEFAULT_RECENT_DAYS = 30;

    private final LeagueCatalogService leagueCatalog;
    private final FeatureGeneratorService featureGenerator;

    public ResolvedTheory resolve(FilterBundle filters, List<GeneratedFeature> features, TargetDefinition target,
                                  TriggerDefinition trigger, ExposureControls exposure, CleaningOptions cleaning,
                                  AnalysisContext context, WalkforwardWindow window) {
        if (filters == null) {
            throw new TheoryConfigurationException("filters", "Les filtres sont requis");
        }
        LeagueProfile league = leagueCatalog.require(filters.getLeagueCode());

        return new ResolvedTheory(
                league,
                normalizeFilters(filters, league),
                resolveFeatures(features, league),
                resolveTarget(target),
                validateTrigger(trigger == null ? TriggerDefinition.defaults() : trigger),
                validateExposure(exposure == null ? ExposureControls.defaults() : exposure),
                validateCleaning(cleaning == null ? CleaningOptions.none() : cleaning),
                context == null ? AnalysisContext.DEPLOYABLE : context,
                window == null ? null : validateWindow(window)
        );
    }

    FilterBundle normalizeFilters(FilterBundle filters, LeagueProfile league) {
        List<Integer> seasons = filters.getSeasons() == null ? List.of() : filters.getSeasons();
        for (Integer season : seasons) {
            if (season == null || season < 1900 || season > 2100) {
                throw new TheoryConfigurationException("filters.seasons", "Saison invalide : " + season);
            }
        }
        SeasonScope scope = filters.getSeasonScope() == null ? SeasonScope.FULL : filters.getSeasonScope();
        Integer recentDays = filters.getRecentDays();
        if (recentDays != null && recentDays <= 0) {
            throw new TheoryConfigurationException("filters.recentDays", "recentDays doit être positif");
        }
        if (scope == SeasonScope.RECENT && recentDays == null) {
            recentDays = DEFAULT_RECENT_DAYS;
        }
        if (scope != SeasonScope.RECENT) {
            recentDays = null;
        }
        if (filters.getDateStart() != null && filters.getDateEnd() != null
                && filters.getDateStart().isAfter(filters.getDateEnd())) {
            throw new TheoryConfigurationException("filters.dateStart", "dateStart doit précéder dateEnd");
        }
        Double spreadMin = filters.getSpreadMin();
        Double spreadMax = filters.getSpreadMax();
        if ((spreadMin != null && spreadMin < 0) || (spreadMax != null && spreadMax < 0)) {
            throw new TheoryConfigurationException("filters.spreadMin", "La bande de spread porte sur la valeur absolue et doit être positive");
        }
        if (spreadMin != null && spreadMax != null && spreadMin > spreadMax) {
            throw new TheoryConfigurationException("filters.spreadMin",
                    "spreadMin (" + spreadMin + ") doit être inférieur ou égal à spreadMax (" + spreadMax + ")");
        }
        GamePhase phase = filters.getPhase() == null ? GamePhase.ALL : filters.getPhase();

        return FilterBundle.builder()
                .leagueCode(league.code())
                .seasons(new ArrayList<>(new TreeSet<>(seasons)))
                .seasonScope(scope)
                .recentDays(recentDays)
                .phase(league.phased() ? phase : GamePhase.ALL)
                .dateStart(filters.getDateStart())
                .dateEnd(filters.getDateEnd())
                .team(blankToNull(filters.getTeam()))
                .player(blankToNull(filters.getPlayer()))
                .spreadMin(spreadMin)
                .spreadMax(spreadMax)
                .build();
    }

    List<FeatureDefinition> resolveFeatures(List<GeneratedFeature> features, LeagueProfile league) {
        if (features == null || features.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<FeatureDefinition> defs = new ArrayList<>();
        for (int i = 0; i < features.size(); i++) {
            GeneratedFeature feature = features.get(i);
            String field = "features[" + i + "].name";
            if (feature == null || feature.getName() == null || feature.getName().isBlank()) {
                throw new TheoryConfigurationException(field, "Le nom de la feature est requis");
            }
            String name = feature.getName().trim();
            if (!seen.add(name)) {
                throw new TheoryConfigurationException(field, "Feature en double : " + name);
            }
            FeatureDefinition def = featureGenerator.parse(name, league).orElseThrow(() ->
                    new TheoryConfigurationException(field, ReasonCode.UNKNOWN_FEATURE,
                            "Feature inconnue pour " + league.code() + " : " + name));
            defs.add(def);
        }
        return defs;
    }

    TargetDefinition resolveTarget(TargetDefinition target) {
        if (target == null) {
            return TargetDefinitions.defaultTarget();
        }
        if (target.getTargetClass() == null) {
            throw new TheoryConfigurationException("target.targetClass", "targetClass est requis");
        }
        if (target.isStat()) {
            String name = target.getTargetName() == null ? null : target.getTargetName().trim().toLowerCase();
            MetricType expected = name == null ? null : TargetDefinitions.STAT_TARGETS.get(name);
            if (expected == null) {
                throw new TheoryConfigurationException("target.targetName",
                        "Cible stat inconnue : " + name + ". Cibles supportées : " + TargetDefinitions.STAT_TARGETS.keySet());
            }
            if (target.getMetricType() != null && target.getMetricType() != expected) {
                throw new TheoryConfigurationException("target.metricType",
                        "La cible " + name + " est de type " + expected.getCode());
            }
            return TargetDefinitions.stat(name);
        }

        if (target.getMarketType() == null) {
            throw new TheoryConfigurationException("target.marketType", "marketType est requis pour une cible marché");
        }
        if (!target.getMarketType().acceptsSide(target.getSide())) {
            throw new TheoryConfigurationException("target.side",
                    "Côté invalide pour " + target.getMarketType().getCode() + " : " + target.getSide()
                            + " (attendu : " + target.getMarketType().getSides() + ")");
        }
        if (target.getMetricType() == MetricType.NUMERIC) {
            throw new TheoryConfigurationException("target.metricType", "Une cible marché est toujours binaire");
        }
        OddsAssumption assumption = target.getOddsAssumption() == null ? OddsAssumption.USE_CLOSING : target.getOddsAssumption();
        TargetDefinition resolved = TargetDefinitions.market(target.getMarketType(), target.getSide(), assumption);
        resolved.setOddsRequired(target.isOddsRequired());
        return resolved;
    }

    TriggerDefinition validateTrigger(TriggerDefinition trigger) {
        if (trigger.getProbThreshold() < 0 || trigger.getProbThreshold() > 1) {
            throw new TheoryConfigurationException("trigger.probThreshold", "probThreshold doit être entre 0 et 1");
        }
        Double band = trigger.getConfidenceBand();
        if (band != null && (band < 0 || band > 0.5)) {
            throw new TheoryConfigurationException("trigger.confidenceBand", "confidenceBand doit être entre 0 et 0.5");
        }
        Double minEdge = trigger.getMinEdgeVsImplied();
        if (minEdge != null && (minEdge < -1 || minEdge > 1)) {
            throw new TheoryConfigurationException("trigger.minEdgeVsImplied", "minEdgeVsImplied doit être entre -1 et 1");
        }
        return trigger;
    }

    ExposureControls validateExposure(ExposureControls exposure) {
        if (exposure.getMaxBetsPerDay() != null && exposure.getMaxBetsPerDay() < 0) {
            throw new TheoryConfigurationException("exposure.maxBetsPerDay", "maxBetsPerDay doit être positif ou nul");
        }
        if (exposure.getMaxBetsPerSidePerDay() != null && exposure.getMaxBetsPerSidePerDay() < 0) {
            throw new TheoryConfigurationException("exposure.maxBetsPerSidePerDay", "maxBetsPerSidePerDay doit être positif ou nul");
        }
        Double min = exposure.getSpreadAbsMin();
        Double max = exposure.getSpreadAbsMax();
        if ((min != null && min < 0) || (max != null && max < 0)) {
            throw new TheoryConfigurationException("exposure.spreadAbsMin", "Les bornes de spread doivent être positives");
        }
        if (min != null && max != null && max < min) {
            throw new TheoryConfigurationException("exposure.spreadAbsMax", "spreadAbsMax doit être supérieur ou égal à spreadAbsMin");
        }
        return exposure;
    }

    CleaningOptions validateCleaning(CleaningOptions cleaning) {
        if (cleaning.getMinNonNullFeatures() != null && cleaning.getMinNonNullFeatures() < 0) {
            throw new TheoryConfigurationException("cleaning.minNonNullFeatures", "minNonNullFeatures doit être positif ou nul");
        }
        return cleaning;
    }

    WalkforwardWindow validateWindow(WalkforwardWindow window) {
        checkBounds("window.trainDays", window.getTrainDays(), WalkforwardWindow.MIN_TRAIN_DAYS, WalkforwardWindow.MAX_TRAIN_DAYS);
        checkBounds("window.testDays", window.getTestDays(), WalkforwardWindow.MIN_TEST_DAYS, WalkforwardWindow.MAX_TEST_DAYS);
        checkBounds("window.stepDays", window.getStepDays(), WalkforwardWindow.MIN_TEST_DAYS, WalkforwardWindow.MAX_TEST_DAYS);
        return window;
    }

    private static void checkBounds(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new TheoryConfigurationException(field, field + " doit être entre " + min + " et " + max + " (reçu : " + value + ")");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim().toLowerCase();
    }
}
