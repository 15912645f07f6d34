package com.tony.theoryEngine.exception;

/**
 * Opération interrompue (timeout appelant ou annulation). Rien n'est écrit dans le Run Store.
 */
public class OperationTimeoutException extends RuntimeException {

    public OperationTimeoutException(String message) {
        super(message);
    }

    public OperationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
