package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum MarketType {
    SPREAD("spread", List.of("home", "away")),
    TOTAL("total", List.of("over", "under")),
    MONEYLINE("moneyline", List.of("home", "away"));

    private final String code;
    private final List<String> sides;

    MarketType(String code, List<String> sides) {
        this.code = code;
        this.sides = sides;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public List<String> getSides() {
        return sides;
    }

    public boolean acceptsSide(String side) {
        return side != null && sides.contains(side.toLowerCase());
    }
}
