package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunType {
    ANALYZE("analyze"),
    MODEL("model"),
    WALKFORWARD("walkforward");

    private final String code;

    RunType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
