package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MetricType {
    NUMERIC("numeric"),
    BINARY("binary");

    private final String code;

    MetricType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
