package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Codes stables renvoyés aux appelants pour chaque refus ou résultat indisponible.
 */
public enum ReasonCode {
    INSUFFICIENT_SAMPLE("insufficient_sample"),
    NO_ODDS_COVERAGE("no_odds_coverage"),
    TOO_FEW_BETS("too_few_bets"),
    STAT_TARGET_NOT_ELIGIBLE("stat_target_not_eligible"),
    NUMERIC_TARGET_NO_PROBABILITY("numeric_target_no_probability"),
    NOT_REQUESTED("not_requested"),
    NO_FEATURES("no_features"),
    MODEL_FIT_FAILED("model_fit_failed"),
    NO_SLICES("no_slices"),
    INVALID_CONFIGURATION("invalid_configuration"),
    UNKNOWN_LEAGUE("unknown_league"),
    UNKNOWN_FEATURE("unknown_feature"),
    UPSTREAM_UNAVAILABLE("upstream_unavailable"),
    OPERATION_TIMEOUT("operation_timeout"),
    RUN_NOT_FOUND("run_not_found"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
