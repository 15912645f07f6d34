package com.tony.theoryEngine.exception;

import lombok.Getter;

@Getter
public class RunNotFoundException extends RuntimeException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run introuvable : " + runId);
        this.runId = runId;
    }
}
