package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;

/**
 * Raised when a connection cannot be obtained: retries exhausted or a non-transient failure.
 */
public class ConnectionFailureException extends EtlException {

    private final int attempts;

    public ConnectionFailureException(String message, int attempts, Throwable cause) {
        super(ErrorKind.CONNECTION_ERROR, null, EtlStage.CONNECT, message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
