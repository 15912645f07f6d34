package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisContext {
    DEPLOYABLE("deployable"),
    DIAGNOSTIC("diagnostic");

    private final String code;

    AnalysisContext(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
