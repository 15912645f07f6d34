package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

// Le prix plat -110 ne sert qu'à la comparaison diagnostique
public enum OddsAssumption {
    USE_CLOSING("use_closing"),
    FLAT_MINUS_110("flat_-110");

    private final String code;

    OddsAssumption(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
