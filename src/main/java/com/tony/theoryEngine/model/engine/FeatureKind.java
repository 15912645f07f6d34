package com.tony.theoryEngine.model.engine;

public enum FeatureKind {
    RAW_HOME, RAW_AWAY, DIFF, TOTAL,
    REST_HOME, REST_AWAY, REST_ADVANTAGE,
    ROLLING_HOME, ROLLING_AWAY, ROLLING_DIFF
}
