package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Durable, resumable record of one bulk operation's progress. Immutable: every state change made by
 * {@link CheckpointManager} produces a new value, so a batch is applied to the checkpoint as a whole
 * or not at all.
 */
public record Checkpoint(
        @JsonProperty("id") String id,
        @JsonProperty("operation_type") OperationType operationType,
        @JsonProperty("status") CheckpointStatus status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("config") OperationConfig config,
        @JsonProperty("progress") BatchProgress progress,
        @JsonProperty("results") ProcessingResults results,
        @JsonProperty("remaining_items") List<String> remainingItems,
        @JsonProperty("processed_items") List<String> processedItems,
        @JsonProperty("version") String version
) {
    public static final String CURRENT_VERSION = "1.0.0";
    /**
     * Assigned to documents written before the version field existed. Never equal to
     * {@link #CURRENT_VERSION}, so such checkpoints can be inspected but not resumed.
     */
    public static final String LEGACY_VERSION = "0.0.0";

    public Checkpoint {
        status = status == null ? CheckpointStatus.ACTIVE : status;
        config = config == null ? OperationConfig.forEnvironment(null) : config;
        results = results == null ? ProcessingResults.empty() : results;
        remainingItems = remainingItems == null ? List.of() : List.copyOf(remainingItems);
        processedItems = processedItems == null ? List.of() : List.copyOf(processedItems);
        progress = progress == null
                ? BatchProgress.start(remainingItems.size() + processedItems.size(), BatchProgress.DEFAULT_BATCH_SIZE)
                : progress;
        version = version == null || version.isBlank() ? LEGACY_VERSION : version;
    }

    public Checkpoint withStatus(CheckpointStatus newStatus, Instant now) {
        return new Checkpoint(id, operationType, newStatus, createdAt, now, config, progress, results,
                remainingItems, processedItems, version);
    }

    public Checkpoint withUpdatedAt(Instant now) {
        return new Checkpoint(id, operationType, status, createdAt, now, config, progress, results,
                remainingItems, processedItems, version);
    }

    public Checkpoint withResults(ProcessingResults newResults, Instant now) {
        return new Checkpoint(id, operationType, status, createdAt, now, config, progress, newResults,
                remainingItems, processedItems, version);
    }

    Checkpoint withBatchApplied(BatchProgress newProgress,
                                ProcessingResults newResults,
                                List<String> newRemaining,
                                List<String> newProcessed,
                                CheckpointStatus newStatus,
                                Instant now) {
        return new Checkpoint(id, operationType, newStatus, createdAt, now, config, newProgress, newResults,
                newRemaining, newProcessed, version);
    }

    public boolean versionCompatible() {
        return CURRENT_VERSION.equals(version);
    }

    /**
     * A checkpoint can be resumed while it is not completed, still has work left and was written by
     * this schema version.
     */
    public boolean resumable() {
        return status.resumable() && !remainingItems.isEmpty() && versionCompatible();
    }

    public double completionPercentage() {
        return progress.completionPercentage();
    }

    public double successRate() {
        return results.successRate();
    }

    public CheckpointSummary summary() {
        return CheckpointSummary.from(this);
    }
}
