package com.nbastats.updater.task;

import java.time.Instant;

/**
 * Immutable view of a task at one point in time.
 */
public record TaskSnapshot(
        String id,
        String name,
        String description,
        TaskState state,
        double progress,
        String currentStep,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String errorMessage,
        double durationSeconds
) {}
