package com.nbastats.updater.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Progress and error state of a single ingestion phase.
 *
 * updated is true exactly when percentComplete is 100 and lastError is null.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PhaseStatus {

    private boolean updated;
    private int percentComplete;    // 0..100
    private String lastError;
    private Instant lastUpdate;     // last successful completion
    private Instant startTime;

    public static PhaseStatus notStarted() {
        return new PhaseStatus();
    }
}
