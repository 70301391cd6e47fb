package com.nbastats.updater.task;

import com.nbastats.updater.config.StatsUpdaterProperties;
import com.nbastats.updater.exception.TaskCancelledException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs arbitrary units of work in the background and keeps an in-memory record of each one.
 *
 * Knows nothing about ingestion: it starts work, tracks its lifecycle, exposes
 * cooperative and hard cancellation, and forgets old finished tasks.
 */
@Component
@Slf4j
public class BackgroundTaskRunner {

    private final Map<String, TaskInfo> tasks = new ConcurrentHashMap<>();
    private final AsyncTaskExecutor executor;
    private final Clock clock;
    private final int maxFinishedTasks;
    private final Duration cancelTimeout;

    public BackgroundTaskRunner(@Qualifier("updateTaskExecutor") AsyncTaskExecutor executor,
                                StatsUpdaterProperties properties,
                                Clock clock) {
        this.executor = executor;
        this.clock = clock;
        this.maxFinishedTasks = properties.getTasks().getMaxFinishedTasks();
        this.cancelTimeout = Duration.ofMillis(properties.getTasks().getCancelTimeoutMs());
    }

    /**
     * Start {@code work} in the background and return its task id immediately.
     */
    public String createTask(String name, String description, TaskWork work) {
        return createTask(name, description, work, null);
    }

    /**
     * As {@link #createTask(String, String, TaskWork)}, calling {@code onFinished} exactly once
     * when the task reaches a terminal state. This includes tasks cancelled before they started
     * and tasks the executor refused.
     *
     * @throws TaskRejectedException if the executor refuses the work; the task is recorded as failed
     */
    public String createTask(String name, String description, TaskWork work, Consumer<TaskSnapshot> onFinished) {
        String taskId = UUID.randomUUID().toString();
        TaskInfo info = new TaskInfo(taskId, name, description, clock, onFinished);
        tasks.put(taskId, info);

        try {
            info.setFuture(executor.submit(() -> execute(info, work)));
        } catch (TaskRejectedException e) {
            log.error("Task {} ({}) was rejected by the executor: {}", taskId, name, e.getMessage());
            info.markFailed("Rejected by executor: " + e.getMessage());
            throw e;
        }

        log.info("Created task {}: {}", taskId, name);
        return taskId;
    }

    /**
     * Signal the task's token only. The work stops at its next cooperative check.
     *
     * @return false if the task is unknown or already finished
     */
    public boolean requestCancellation(String taskId) {
        TaskInfo info = tasks.get(taskId);
        if (info == null || info.getState().isTerminal()) {
            return false;
        }
        info.getCancellationToken().cancel();
        log.info("Cancellation requested for task {}", taskId);
        return true;
    }

    /**
     * Signal the token, interrupt the running work and wait for it to unwind.
     *
     * @return false if the task is unknown or already finished
     */
    public boolean cancel(String taskId) {
        TaskInfo info = tasks.get(taskId);
        if (info == null || info.getState().isTerminal()) {
            return false;
        }

        info.getCancellationToken().cancel();
        Future<?> future = info.getFuture();
        if (future != null) {
            future.cancel(true);
        }
        if (info.getState() == TaskState.PENDING) {
            // never started, so nothing will count the latch down for us
            info.markCancelled();
        }

        try {
            if (!info.awaitFinished(cancelTimeout)) {
                log.warn("Task {} did not unwind within {} ms", taskId, cancelTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        log.info("Cancelled task {}", taskId);
        return true;
    }

    public Optional<TaskSnapshot> getStatus(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(TaskInfo::snapshot);
    }

    public List<TaskSnapshot> getAllTasks() {
        return tasks.values().stream()
                .map(TaskInfo::snapshot)
                .sorted(Comparator.comparing(TaskSnapshot::createdAt))
                .toList();
    }

    public List<TaskSnapshot> getActiveTasks() {
        return getAllTasks().stream()
                .filter(t -> !t.state().isTerminal())
                .toList();
    }

    /**
     * Block until the task finishes or the timeout elapses, then return its snapshot.
     */
    public Optional<TaskSnapshot> waitForTask(String taskId, Duration timeout) throws InterruptedException {
        TaskInfo info = tasks.get(taskId);
        if (info == null) {
            return Optional.empty();
        }
        if (!info.awaitFinished(timeout)) {
            log.warn("Task {} still running after {} ms", taskId, timeout.toMillis());
        }
        return Optional.of(info.snapshot());
    }

    /**
     * Drop the oldest finished tasks beyond the retention bound.
     *
     * @return number of tasks removed
     */
    @Scheduled(fixedDelayString = "${stats-updater.tasks.cleanup-interval-ms:300000}",
            initialDelayString = "${stats-updater.tasks.cleanup-interval-ms:300000}")
    public int reapFinishedTasks() {
        List<TaskInfo> finished = tasks.values().stream()
                .filter(t -> t.getState().isTerminal())
                .sorted(Comparator.comparing(TaskInfo::finishedOrCreatedAt).reversed())
                .toList();

        if (finished.size() <= maxFinishedTasks) {
            return 0;
        }

        List<TaskInfo> expired = finished.subList(maxFinishedTasks, finished.size());
        expired.forEach(t -> {
            tasks.remove(t.getId());
            log.debug("Cleaned up old task {}", t.getId());
        });
        log.info("Removed {} finished tasks (keeping {})", expired.size(), maxFinishedTasks);
        return expired.size();
    }

    @PreDestroy
    public void shutdown() {
        List<String> running = tasks.values().stream()
                .filter(t -> !t.getState().isTerminal())
                .map(TaskInfo::getId)
                .toList();
        if (!running.isEmpty()) {
            log.info("Shutting down: cancelling {} unfinished task(s)", running.size());
            running.forEach(this::cancel);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void execute(TaskInfo info, TaskWork work) {
        if (!info.markRunning()) {
            return;
        }
        log.info("Starting task {}: {}", info.getId(), info.getName());

        try {
            work.run(new TaskContext(info));
            if (info.getCancellationToken().isCancellationRequested()) {
                info.markCancelled();
                log.info("Task {} was cancelled", info.getId());
            } else {
                info.markCompleted();
                log.info("Task {} completed successfully", info.getId());
            }
        } catch (TaskCancelledException e) {
            info.markCancelled();
            log.info("Task {} was cancelled: {}", info.getId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            info.markCancelled();
            log.info("Task {} was interrupted", info.getId());
        } catch (Exception e) {
            info.markFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("Task {} failed: {}", info.getId(), e.getMessage());
        } finally {
            if (!info.getState().isTerminal()) {
                info.markFailed("Task terminated unexpectedly");
            }
        }
    }
}
