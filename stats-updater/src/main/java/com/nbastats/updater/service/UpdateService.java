package com.nbastats.updater.service;

import com.nbastats.updater.exception.TaskCancelledException;
import com.nbastats.updater.exception.UpdateInProgressException;
import com.nbastats.updater.model.Phase;
import com.nbastats.updater.model.UpdateStatus;
import com.nbastats.updater.service.UpdateOrchestrator.Outcome;
import com.nbastats.updater.task.BackgroundTaskRunner;
import com.nbastats.updater.task.TaskSnapshot;
import com.nbastats.updater.task.TaskState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Entry point for starting, cancelling and observing pipeline runs.
 *
 * Single-flight is advisory: the check reads the persisted updating flag, so two triggers
 * racing past the check can both start a run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UpdateService {

    private final UpdateStatusService statusService;
    private final UpdateOrchestrator orchestrator;
    private final BackgroundTaskRunner taskRunner;

    private final AtomicReference<String> activeTaskId = new AtomicReference<>();

    /**
     * Start a background run of {@code phases}.
     *
     * @return id of the background task running the pipeline
     * @throws UpdateInProgressException if a run is already in progress; nothing is written
     */
    public String triggerUpdate(Collection<Phase> phases) {
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("At least one phase is required");
        }
        UpdateStatus status = statusService.getStatus();
        if (status.isUpdating()) {
            throw new UpdateInProgressException(status.getCurrentPhase());
        }

        Set<Phase> ordered = EnumSet.copyOf(phases);
        statusService.beginRun(ordered);

        String keys = ordered.stream().map(Phase::key).collect(Collectors.joining(", "));
        String taskId = taskRunner.createTask(
                ordered.size() == Phase.values().length ? "full-update" : "update-" + keys.replace(", ", "-"),
                "Update " + keys,
                context -> {
                    Outcome outcome = orchestrator.updateAll(ordered, context.cancellationToken(),
                            (phase, processed, total) -> context.updateProgress(
                                    overallProgress(ordered, phase, processed, total),
                                    phase.displayName() + ": " + processed + "/" + total));
                    switch (outcome) {
                        case CANCELLED -> throw new TaskCancelledException("Update cancelled");
                        case FAILED -> throw new IllegalStateException(
                                "Update failed: " + Optional.ofNullable(statusService.getStatus().getLastError())
                                        .orElse("unknown error"));
                        case COMPLETED -> context.updateProgress(100, "Completed");
                    }
                },
                task -> releaseRun(ordered, task));
        activeTaskId.set(taskId);

        log.info("Triggered update of {} as task {}", keys, taskId);
        return taskId;
    }

    public String triggerFullUpdate() {
        return triggerUpdate(Phase.all());
    }

    /**
     * Flag the persisted record and signal the running task's token. Always succeeds.
     */
    public UpdateStatus requestCancellation() {
        UpdateStatus status = statusService.requestCancellation();
        String taskId = activeTaskId.get();
        if (taskId != null && taskRunner.requestCancellation(taskId)) {
            log.info("Cancellation signalled to task {}", taskId);
        } else {
            log.info("Cancellation requested with no running update task");
        }
        return status;
    }

    public UpdateStatus getStatus() {
        return statusService.getStatus();
    }

    public Optional<String> getActiveTaskId() {
        return Optional.ofNullable(activeTaskId.get());
    }

    /**
     * Clear the persisted updating flag when the task ended without the pipeline clearing it,
     * such as an exception escaping the pipeline or a task that never got to run.
     */
    private void releaseRun(Set<Phase> phases, TaskSnapshot task) {
        if (task.state() == TaskState.COMPLETED) {
            return;
        }
        UpdateStatus status = statusService.getStatus();
        if (!status.isUpdating()) {
            return;
        }
        Phase phase = status.getCurrentPhase() != null ? status.getCurrentPhase() : phases.iterator().next();
        if (task.state() == TaskState.CANCELLED) {
            log.info("Task {} cancelled outside the pipeline; releasing {} phase", task.id(), phase.key());
            statusService.markCancelled(phase);
        } else {
            String message = task.errorMessage() != null ? task.errorMessage() : "Update task failed";
            log.warn("Task {} ended abnormally during {} phase: {}", task.id(), phase.key(), message);
            statusService.recordError(phase, message);
        }
    }

    static double overallProgress(Set<Phase> phases, Phase phase, int processed, int total) {
        int index = 0;
        for (Phase p : phases) {
            if (p == phase) {
                break;
            }
            index++;
        }
        double phaseFraction = total > 0 ? (double) processed / total : 0.0;
        return (index + phaseFraction) * 100.0 / phases.size();
    }
}
