package com.nbastats.updater.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The single persisted record describing the ingestion pipeline.
 * Stored in the update_status table under {@link #SINGLETON_ID}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStatus {

    public static final int SINGLETON_ID = 1;

    private boolean updating;
    private boolean cancellationRequested;
    private Phase currentPhase;
    private String currentDetail;
    private String lastError;
    private Instant lastErrorTime;
    private Instant lastSuccessfulUpdate;
    private Instant nextScheduledUpdate;

    /** Phases of the current run that have not been finalised yet, in run order. */
    @Builder.Default
    private List<Phase> pendingPhases = new ArrayList<>();

    @Builder.Default
    private Map<Phase, PhaseStatus> phases = emptyPhases();

    public static UpdateStatus initial() {
        return UpdateStatus.builder().build();
    }

    /**
     * State of a phase, created on first access so every phase is always present.
     */
    public PhaseStatus phase(Phase phase) {
        return phases.computeIfAbsent(phase, p -> PhaseStatus.notStarted());
    }

    public boolean allPhasesComplete() {
        for (Phase phase : Phase.values()) {
            if (!phase(phase).isUpdated()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Deep copy, so callers can hold a snapshot while the pipeline keeps writing.
     */
    public UpdateStatus copy() {
        Map<Phase, PhaseStatus> copiedPhases = emptyPhases();
        phases.forEach((phase, state) -> copiedPhases.put(phase, state.toBuilder().build()));
        return toBuilder()
                .pendingPhases(new ArrayList<>(pendingPhases))
                .phases(copiedPhases)
                .build();
    }

    private static Map<Phase, PhaseStatus> emptyPhases() {
        Map<Phase, PhaseStatus> map = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            map.put(phase, PhaseStatus.notStarted());
        }
        return map;
    }
}
