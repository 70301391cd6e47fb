package com.nbastats.updater.repository;

import com.nbastats.updater.model.UpdateStatus;

/**
 * Storage for the single {@link UpdateStatus} record.
 *
 * No locking: concurrent read-then-write pairs are last-writer-wins.
 */
public interface UpdateStatusRepository {

    /**
     * Load the record, creating it with initial values if it does not exist yet.
     */
    UpdateStatus read();

    void write(UpdateStatus status);
}
