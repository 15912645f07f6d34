package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.MarketType;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.OddsAssumption;
import com.tony.theoryEngine.model.engine.TargetClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fabrique explicite des cibles. Aucune cible par défaut n'est gardée en état partagé :
 * chaque appel renvoie une nouvelle instance.
 */
public final class TargetDefinitions {

    public static final String COMBINED_SCORE = "combined_score";
    public static final String MARGIN_OF_VICTORY = "margin_of_victory";
    public static final String HOME_POINTS = "home_points";
    public static final String AWAY_POINTS = "away_points";
    public static final String HOME_WIN = "home_win";
    public static final String AWAY_WIN = "away_win";

    public static final Map<String, MetricType> STAT_TARGETS;

    static {
        Map<String, MetricType> targets = new LinkedHashMap<>();
        targets.put(COMBINED_SCORE, MetricType.NUMERIC);
        targets.put(MARGIN_OF_VICTORY, MetricType.NUMERIC);
        targets.put(HOME_POINTS, MetricType.NUMERIC);
        targets.put(AWAY_POINTS, MetricType.NUMERIC);
        targets.put(HOME_WIN, MetricType.BINARY);
        targets.put(AWAY_WIN, MetricType.BINARY);
        STAT_TARGETS = Collections.unmodifiableMap(targets);
    }

    private TargetDefinitions() {
    }

    public static TargetDefinition defaultTarget() {
        return stat(COMBINED_SCORE);
    }

    public static TargetDefinition stat(String targetName) {
        MetricType metricType = STAT_TARGETS.getOrDefault(targetName, MetricType.NUMERIC);
        return TargetDefinition.builder()
                .targetClass(TargetClass.STAT)
                .targetName(targetName)
                .metricType(metricType)
                .oddsRequired(false)
                .build();
    }

    public static TargetDefinition market(MarketType marketType, String side) {
        return market(marketType, side, OddsAssumption.USE_CLOSING);
    }

    public static TargetDefinition market(MarketType marketType, String side, OddsAssumption oddsAssumption) {
        return TargetDefinition.builder()
                .targetClass(TargetClass.MARKET)
                .targetName(marketType.getCode() + "_" + side.toLowerCase())
                .metricType(MetricType.BINARY)
                .marketType(marketType)
                .side(side.toLowerCase())
                .oddsAssumption(oddsAssumption)
                .oddsRequired(true)
                .build();
    }

    // Côté parié : pour les cibles stat binaires on suit le nom de la cible
    public static String sideOf(TargetDefinition target) {
        if (target.isMarket()) {
            return target.getSide();
        }
        return AWAY_WIN.equals(target.getTargetName()) || AWAY_POINTS.equals(target.getTargetName()) ? "away" : "home";
    }
}
