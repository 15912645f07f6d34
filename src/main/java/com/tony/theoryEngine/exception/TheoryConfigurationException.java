package com.tony.theoryEngine.exception;

import com.tony.theoryEngine.model.engine.ReasonCode;
import lombok.Getter;

/**
 * Requête mal formée, levée avant tout accès aux données.
 */
@Getter
public class TheoryConfigurationException extends RuntimeException {

    private final String field;
    private final ReasonCode reasonCode;

    public TheoryConfigurationException(String field, String message) {
        this(field, ReasonCode.INVALID_CONFIGURATION, message);
    }

    public TheoryConfigurationException(String field, ReasonCode reasonCode, String message) {
        super(message);
        this.field = field;
        this.reasonCode = reasonCode;
    }
}
