package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FeatureTiming {
    PRE_GAME("pre_game"),
    POST_GAME("post_game");

    private final String code;

    FeatureTiming(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
