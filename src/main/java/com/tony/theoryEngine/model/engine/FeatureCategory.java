package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FeatureCategory {
    RAW("raw"),
    DIFFERENTIAL("differential"),
    COMBINED("combined"),
    SITUATIONAL("situational"),
    ROLLING("rolling");

    private final String code;

    FeatureCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
