package com.tony.theoryEngine.exception;

public class ModelFitException extends RuntimeException {

    public ModelFitException(String message) {
        super(message);
    }

    public ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
