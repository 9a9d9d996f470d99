package com.example.bulkops;

import com.example.bulkops.checkpoint.Checkpoint;

import java.io.IOException;

/**
 * Progress callbacks from {@link BatchProcessor}.
 */
public interface BatchListener {
    default void batchStarted(int batchNumber, int totalBatches, int itemCount) {
    }

    /**
     * Called once a batch has been attempted and before it is written to the checkpoint. Output the
     * batch produced must be durable when this returns; a failure keeps the batch out of the checkpoint.
     */
    default void beforeCheckpointSave(int batchNumber) throws IOException {
    }

    default void batchFinished(int batchNumber, Checkpoint checkpoint) {
    }

    BatchListener NOOP = new BatchListener() {
    };
}
