package com.nbastats.updater.task;

import com.nbastats.updater.exception.TaskCancelledException;

/**
 * Cooperative cancellation flag handed to a unit of work.
 * Work polls it between steps; it never preempts anything by itself.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new TaskCancelledException("Cancellation requested");
        }
    }
}
