package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BatchProgress(
        @JsonProperty("current_batch") int currentBatch,
        @JsonProperty("total_batches") int totalBatches,
        @JsonProperty("current_item") int currentItem,
        @JsonProperty("total_items") int totalItems,
        @JsonProperty("batch_size") int batchSize
) {
    public static final int DEFAULT_BATCH_SIZE = 50;

    public BatchProgress {
        batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
    }

    public static BatchProgress start(int totalItems, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        int totalBatches = (totalItems + batchSize - 1) / batchSize;
        return new BatchProgress(0, totalBatches, 0, totalItems, batchSize);
    }

    /**
     * Advances past one batch in which {@code attempted} items were handed to the operation.
     */
    public BatchProgress advance(int attempted) {
        return new BatchProgress(currentBatch + 1, totalBatches, currentItem + attempted, totalItems, batchSize);
    }

    public double completionPercentage() {
        if (totalItems == 0) {
            return 0.0;
        }
        return (double) currentItem / totalItems * 100.0;
    }
}
