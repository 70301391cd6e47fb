package com.nbastats.updater.exception;

/**
 * The stats provider kept failing with retryable errors (timeout, 429, 5xx)
 * until the retry budget of a single fetch ran out.
 */
public class TransientExternalException extends RuntimeException {

    private final int attempts;

    public TransientExternalException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
