package com.tony.theoryEngine.model.engine;

/**
 * Forme analysée d'un nom de feature ({@code rolling_points_5_home}, {@code rebounds_diff}...).
 */
public record FeatureDefinition(String name, FeatureKind kind, String stat, int window) {

    public boolean isRolling() {
        return kind == FeatureKind.ROLLING_HOME || kind == FeatureKind.ROLLING_AWAY || kind == FeatureKind.ROLLING_DIFF;
    }

    public boolean isRest() {
        return kind == FeatureKind.REST_HOME || kind == FeatureKind.REST_AWAY || kind == FeatureKind.REST_ADVANTAGE;
    }
}
