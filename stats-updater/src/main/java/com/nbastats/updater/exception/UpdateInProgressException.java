package com.nbastats.updater.exception;

import com.nbastats.updater.model.Phase;

public class UpdateInProgressException extends RuntimeException {

    public UpdateInProgressException(Phase currentPhase) {
        super(currentPhase == null
                ? "Update already in progress"
                : "Update already in progress (phase: " + currentPhase.key() + ")");
    }
}
