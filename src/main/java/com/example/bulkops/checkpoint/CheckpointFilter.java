package com.example.bulkops.checkpoint;

/**
 * Listing filter; a null field matches everything.
 */
public record CheckpointFilter(
        OperationType operationType,
        CheckpointStatus status,
        String environment
) {
    public static final CheckpointFilter ALL = new CheckpointFilter(null, null, null);

    public static CheckpointFilter byStatus(CheckpointStatus status) {
        return new CheckpointFilter(null, status, null);
    }

    public boolean matches(Checkpoint checkpoint) {
        if (operationType != null && checkpoint.operationType() != operationType) {
            return false;
        }
        if (status != null && checkpoint.status() != status) {
            return false;
        }
        return environment == null || environment.equals(checkpoint.config().environment());
    }
}
