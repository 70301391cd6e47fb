package com.nbastats.updater.task;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Mutable in-memory record of one task, owned by {@link BackgroundTaskRunner}.
 * State only moves forward: PENDING, RUNNING, then one terminal state.
 */
@Slf4j
class TaskInfo {

    private final String id;
    private final String name;
    private final String description;
    private final Instant createdAt;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Clock clock;
    private final Consumer<TaskSnapshot> onFinished;

    private TaskState state = TaskState.PENDING;
    private double progress;
    private String currentStep = "";
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;

    private volatile Future<?> future;

    TaskInfo(String id, String name, String description, Clock clock, Consumer<TaskSnapshot> onFinished) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.clock = clock;
        this.onFinished = onFinished;
        this.createdAt = clock.instant();
    }

    String getId() {
        return id;
    }

    String getName() {
        return name;
    }

    CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    Future<?> getFuture() {
        return future;
    }

    void setFuture(Future<?> future) {
        this.future = future;
    }

    synchronized TaskState getState() {
        return state;
    }

    /** Moment the task reached a terminal state, or its creation time if it has not. */
    synchronized Instant finishedOrCreatedAt() {
        return completedAt != null ? completedAt : createdAt;
    }

    synchronized boolean markRunning() {
        if (state != TaskState.PENDING) {
            return false;
        }
        state = TaskState.RUNNING;
        startedAt = clock.instant();
        return true;
    }

    synchronized void updateProgress(double value, String step) {
        if (state.isTerminal()) {
            return;
        }
        progress = Math.min(100.0, Math.max(0.0, value));
        if (step != null) {
            currentStep = step;
        }
    }

    void markCompleted() {
        boolean changed;
        synchronized (this) {
            changed = !state.isTerminal();
            if (changed) {
                state = TaskState.COMPLETED;
                progress = 100.0;
                currentStep = "Completed successfully";
                completedAt = clock.instant();
            }
        }
        finish(changed);
    }

    void markCancelled() {
        boolean changed;
        synchronized (this) {
            changed = !state.isTerminal();
            if (changed) {
                state = TaskState.CANCELLED;
                currentStep = "Task was cancelled";
                completedAt = clock.instant();
            }
        }
        finish(changed);
    }

    void markFailed(String message) {
        boolean changed;
        synchronized (this) {
            changed = !state.isTerminal();
            if (changed) {
                state = TaskState.FAILED;
                errorMessage = message;
                currentStep = "Failed: " + message;
                completedAt = clock.instant();
            }
        }
        finish(changed);
    }

    /** Runs the completion callback once, before waiters are released. */
    private void finish(boolean changed) {
        try {
            if (changed && onFinished != null) {
                onFinished.accept(snapshot());
            }
        } catch (RuntimeException e) {
            log.error("Completion callback of task {} failed: {}", id, e.getMessage(), e);
        } finally {
            finished.countDown();
        }
    }

    boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized TaskSnapshot snapshot() {
        double duration = 0;
        if (startedAt != null) {
            Instant end = completedAt != null ? completedAt : clock.instant();
            duration = Duration.between(startedAt, end).toMillis() / 1000.0;
        }
        return new TaskSnapshot(id, name, description, state, progress, currentStep,
                createdAt, startedAt, completedAt, errorMessage, duration);
    }
}
