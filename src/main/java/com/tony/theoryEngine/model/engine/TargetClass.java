package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TargetClass {
    STAT("stat"),
    MARKET("market");

    private final String code;

    TargetClass(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
