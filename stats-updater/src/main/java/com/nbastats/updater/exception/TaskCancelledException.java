package com.nbastats.updater.exception;

/**
 * Unwinds a unit of work after its cancellation token was signalled or its thread interrupted.
 * Not an error: callers must not record it as a failure.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String message) {
        super(message);
    }

    public TaskCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
