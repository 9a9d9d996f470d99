package com.example.bulkops.checkpoint;

import java.time.Instant;

/**
 * Flat view of a checkpoint for listings, without the item lists.
 */
public record CheckpointSummary(
        String id,
        OperationType operationType,
        CheckpointStatus status,
        String environment,
        Instant createdAt,
        Instant updatedAt,
        double completionPercentage,
        double successRate,
        int totalItems,
        int attemptedItems,
        int remainingItems,
        String inputFile,
        String outputFile,
        boolean resumable
) {
    public static CheckpointSummary from(Checkpoint checkpoint) {
        return new CheckpointSummary(
                checkpoint.id(),
                checkpoint.operationType(),
                checkpoint.status(),
                checkpoint.config().environment(),
                checkpoint.createdAt(),
                checkpoint.updatedAt(),
                checkpoint.completionPercentage(),
                checkpoint.successRate(),
                checkpoint.progress().totalItems(),
                checkpoint.progress().currentItem(),
                checkpoint.remainingItems().size(),
                checkpoint.config().inputFile(),
                checkpoint.config().outputFile(),
                checkpoint.resumable()
        );
    }
}
