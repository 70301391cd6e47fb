package com.nbastats.updater.exception;

/**
 * A fetched payload is malformed or the provider rejected the request outright.
 * Never retried.
 */
public class PermanentDataException extends RuntimeException {

    public PermanentDataException(String message) {
        super(message);
    }

    public PermanentDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
