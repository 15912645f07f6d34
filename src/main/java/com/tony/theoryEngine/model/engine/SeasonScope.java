package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SeasonScope {
    FULL("full"),
    CURRENT("current"),
    RECENT("recent");

    private final String code;

    SeasonScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
