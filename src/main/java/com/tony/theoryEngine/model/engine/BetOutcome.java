package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BetOutcome {
    WIN("win"),
    LOSS("loss"),
    PUSH("push");

    private final String code;

    BetOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
