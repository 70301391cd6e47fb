package com.nbastats.updater.service;

import com.nbastats.updater.model.Phase;
import com.nbastats.updater.model.PhaseStatus;
import com.nbastats.updater.model.UpdateStatus;
import com.nbastats.updater.repository.UpdateStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.function.Consumer;

/**
 * State machine over the persisted {@link UpdateStatus} record.
 *
 * Per phase: not started, in progress (0..99%), then either completed (100%) or failed
 * (error set). Every operation is a read-modify-write of the whole record.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UpdateStatusService {

    private final UpdateStatusRepository repository;
    private final Clock clock;

    public UpdateStatus getStatus() {
        return repository.read().copy();
    }

    /**
     * Mark a run of {@code phases} as started. Called by the trigger boundary
     * before the background task is launched.
     */
    public UpdateStatus beginRun(Collection<Phase> phases) {
        return mutate(status -> {
            ArrayList<Phase> ordered = new ArrayList<>(phases);
            ordered.sort(Comparator.naturalOrder());
            status.setUpdating(true);
            status.setCancellationRequested(false);
            status.setCurrentPhase(ordered.isEmpty() ? null : ordered.get(0));
            status.setPendingPhases(ordered);
            status.setCurrentDetail("Update queued");
        });
    }

    public UpdateStatus initialize(Phase phase) {
        Instant now = clock.instant();
        return mutate(status -> {
            status.setUpdating(true);
            status.setCurrentPhase(phase);
            status.setCancellationRequested(false);
            status.setLastError(null);
            status.setLastErrorTime(null);
            status.setCurrentDetail("Starting " + phase.key() + " update");

            PhaseStatus state = status.phase(phase);
            state.setUpdated(false);
            state.setPercentComplete(0);
            state.setLastError(null);
            state.setStartTime(now);
            log.info("Initialised {} phase", phase.key());
        });
    }

    public UpdateStatus updateProgress(Phase phase, int processed, int total) {
        int percent = percentOf(processed, total);
        return mutate(status -> {
            PhaseStatus state = status.phase(phase);
            state.setPercentComplete(percent);
            state.setUpdated(percent == 100);
            status.setCurrentDetail(phase.displayName() + ": " + processed + "/" + total + " processed");
        });
    }

    /**
     * Mark a phase complete. Global updating state is cleared only when no other phase of
     * the current run is still pending, or every phase is now complete.
     */
    public UpdateStatus finalize(Phase phase) {
        Instant now = clock.instant();
        return mutate(status -> {
            PhaseStatus state = status.phase(phase);
            state.setUpdated(true);
            state.setPercentComplete(100);
            state.setLastError(null);
            state.setLastUpdate(now);

            status.getPendingPhases().remove(phase);
            status.setLastSuccessfulUpdate(now);
            status.setCurrentDetail(phase.displayName() + " update complete");

            if (status.getPendingPhases().isEmpty() || status.allPhasesComplete()) {
                status.setUpdating(false);
                status.setCurrentPhase(null);
                status.getPendingPhases().clear();
            }
            log.info("Finalised {} phase", phase.key());
        });
    }

    public UpdateStatus recordError(Phase phase, String message) {
        Instant now = clock.instant();
        return mutate(status -> {
            PhaseStatus state = status.phase(phase);
            state.setUpdated(false);
            state.setLastError(message);

            status.setUpdating(false);
            status.setCurrentPhase(null);
            status.getPendingPhases().clear();
            status.setLastError(message);
            status.setLastErrorTime(now);
            status.setCurrentDetail(phase.displayName() + " update failed");
            log.warn("Recorded error for {} phase: {}", phase.key(), message);
        });
    }

    /**
     * Leave the record in a non-error, non-updating state after a cancelled phase.
     * Partial progress is kept as it was.
     */
    public UpdateStatus markCancelled(Phase phase) {
        return mutate(status -> {
            status.setUpdating(false);
            status.setCurrentPhase(null);
            status.getPendingPhases().clear();
            status.setCurrentDetail(phase.displayName() + " update cancelled at "
                    + status.phase(phase).getPercentComplete() + "%");
            log.info("{} phase cancelled", phase.displayName());
        });
    }

    /** Always succeeds, whether or not a pipeline is running. */
    public UpdateStatus requestCancellation() {
        return mutate(status -> status.setCancellationRequested(true));
    }

    public UpdateStatus recordScheduledUpdate(Instant nextRun) {
        return mutate(status -> status.setNextScheduledUpdate(nextRun));
    }

    /**
     * Clear an updating flag left behind by a process that died mid-run.
     *
     * @return true if a stale flag was found
     */
    public boolean clearStaleUpdate() {
        UpdateStatus status = repository.read();
        if (!status.isUpdating()) {
            return false;
        }
        Phase phase = status.getCurrentPhase();
        status.setUpdating(false);
        status.setCurrentPhase(null);
        status.getPendingPhases().clear();
        status.setCurrentDetail("Previous update was interrupted"
                + (phase != null ? " during " + phase.key() : ""));
        repository.write(status);
        log.warn("Cleared stale updating flag (phase: {})", phase != null ? phase.key() : "none");
        return true;
    }

    static int percentOf(int processed, int total) {
        if (total <= 0) {
            return 0;
        }
        long percent = (long) processed * 100 / total;
        return (int) Math.max(0, Math.min(100, percent));
    }

    private UpdateStatus mutate(Consumer<UpdateStatus> change) {
        UpdateStatus status = repository.read();
        change.accept(status);
        repository.write(status);
        return status.copy();
    }
}
