package com.example.bulkops;

import com.example.bulkops.checkpoint.Checkpoint;
import com.example.bulkops.checkpoint.CheckpointException;
import com.example.bulkops.checkpoint.CheckpointManager;
import com.example.bulkops.checkpoint.CheckpointNotResumableException;
import com.example.bulkops.checkpoint.CheckpointPersistenceException;
import com.example.bulkops.checkpoint.CheckpointStatus;
import com.example.bulkops.checkpoint.OperationConfig;
import com.example.bulkops.checkpoint.OperationType;
import com.example.bulkops.checkpoint.ProcessingResults;
import com.example.bulkops.ratelimit.RateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Drives items through an {@link ItemOperation} in fixed-size batches, persisting the checkpoint
 * after every batch so a run can stop at any point and be resumed without repeating work.
 *
 * <p>Both {@link #run} and {@link #resume} return the checkpoint id when the run stopped early
 * (shutdown requested or run-level failure) and empty when every item has been attempted. Once a
 * checkpoint exists, no exception escapes: failures are recorded on the checkpoint instead.
 */
public final class BatchProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);

    private final CheckpointManager checkpointManager;
    private final OperationType operationType;
    private final OperationConfig config;
    private final ItemOperation operation;
    private final ItemValidator validator;
    private final ShutdownSignal shutdownSignal;
    private final BatchListener listener;
    private final Clock clock;

    public BatchProcessor(CheckpointManager checkpointManager,
                          OperationType operationType,
                          OperationConfig config,
                          ItemOperation operation) {
        this(checkpointManager, operationType, config, operation, ItemValidator.ACCEPT_ALL, ShutdownSignal.NEVER,
                BatchListener.NOOP);
    }

    public BatchProcessor(CheckpointManager checkpointManager,
                          OperationType operationType,
                          OperationConfig config,
                          ItemOperation operation,
                          ItemValidator validator,
                          ShutdownSignal shutdownSignal,
                          BatchListener listener) {
        this.checkpointManager = checkpointManager;
        this.operationType = operationType;
        this.config = config;
        this.operation = operation;
        this.validator = validator == null ? ItemValidator.ACCEPT_ALL : validator;
        this.shutdownSignal = shutdownSignal == null ? ShutdownSignal.NEVER : shutdownSignal;
        this.listener = listener == null ? BatchListener.NOOP : listener;
        this.clock = Clock.systemUTC();
    }

    /**
     * Starts a new bulk operation over {@code items}.
     *
     * @throws IllegalArgumentException if the batch size is not positive or a required output file is missing
     */
    public Optional<String> run(List<String> items, int batchSize) {
        Checkpoint checkpoint = checkpointManager.create(operationType, config.withBatchSize(batchSize), items, batchSize);
        return drive(checkpoint);
    }

    /**
     * Continues a stored operation from where it stopped. Items already attempted are never handed
     * to the operation again and batch numbering continues from the stored batch.
     *
     * @throws CheckpointException if the checkpoint is missing, unreadable or not resumable
     */
    public Optional<String> resume(String checkpointId) throws CheckpointException {
        Checkpoint checkpoint = checkpointManager.require(checkpointId);
        if (checkpoint.operationType() != operationType) {
            throw new CheckpointNotResumableException(checkpointId,
                    "it belongs to " + checkpoint.operationType().value() + ", not " + operationType.value());
        }
        if (checkpoint.status() == CheckpointStatus.COMPLETED) {
            throw new CheckpointNotResumableException(checkpointId, "it is already completed");
        }
        if (!checkpoint.versionCompatible()) {
            throw new CheckpointNotResumableException(checkpointId,
                    "schema version " + checkpoint.version() + " does not match " + Checkpoint.CURRENT_VERSION);
        }
        try {
            CheckpointManager.requireOutputFile(checkpoint.operationType(), checkpoint.config());
        } catch (IllegalArgumentException ex) {
            throw new CheckpointNotResumableException(checkpointId, ex.getMessage());
        }

        if (checkpoint.remainingItems().isEmpty()) {
            LOGGER.info("No remaining items to process for {}", operationName(checkpoint));
            checkpointManager.complete(checkpoint);
            return Optional.empty();
        }
        LOGGER.info("Resuming from checkpoint: {} ({} of {} items left)", checkpointId,
                checkpoint.remainingItems().size(), checkpoint.progress().totalItems());
        return drive(checkpointManager.reactivate(checkpoint));
    }

    private Optional<String> drive(Checkpoint initial) {
        RunContext run = new RunContext(initial);
        try {
            run.checkpoint = checkpointManager.save(run.checkpoint);
            return processRemaining(run);
        } catch (Exception ex) {
            LOGGER.error("{} failed: {}", operationName(run.checkpoint), ex.getMessage(), ex);
            Checkpoint failed = checkpointManager.markFailed(run.checkpoint, describe(ex));
            try {
                run.checkpoint = checkpointManager.save(failed);
            } catch (CheckpointPersistenceException saveError) {
                LOGGER.error("Could not persist failed state of checkpoint {}", failed.id(), saveError);
            }
            return Optional.of(failed.id());
        } finally {
            if (run.threadInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Optional<String> processRemaining(RunContext run) throws IOException {
        String name = operationName(run.checkpoint);
        int batchSize = run.checkpoint.progress().batchSize();
        LOGGER.info("Processing {} remaining items for {}...", run.checkpoint.remainingItems().size(), name);

        while (!run.checkpoint.remainingItems().isEmpty()) {
            if (shutdownSignal.shouldStop(run.attempted)) {
                return interrupt(run, name + " interrupted");
            }
            List<String> remaining = run.checkpoint.remainingItems();
            List<String> slice = List.copyOf(remaining.subList(0, Math.min(batchSize, remaining.size())));
            int batchNumber = run.checkpoint.progress().currentBatch() + 1;
            int totalBatches = run.checkpoint.progress().totalBatches();
            LOGGER.info("Processing batch {}/{} ({} items, {} remaining)", batchNumber, totalBatches, slice.size(),
                    remaining.size());
            listener.batchStarted(batchNumber, totalBatches, slice.size());

            BatchOutcome outcome = processBatch(slice, run);
            if (!outcome.attempted().isEmpty()) {
                listener.beforeCheckpointSave(batchNumber);
                // Applied before saving so a failed save still leaves the batch on the checkpoint.
                run.checkpoint = checkpointManager.applyBatch(run.checkpoint, outcome.attempted(), outcome.delta());
                run.totals = run.totals.merge(outcome.delta());
                run.checkpoint = checkpointManager.save(run.checkpoint);
                listener.batchFinished(batchNumber, run.checkpoint);
            }
            if (outcome.fatal() != null) {
                throw outcome.fatal();
            }
            if (outcome.interrupted()) {
                return interrupt(run, name + " interrupted during batch processing");
            }
        }

        logSummary(name, run);
        run.checkpoint = checkpointManager.complete(run.checkpoint);
        return Optional.empty();
    }

    /**
     * Handles one slice in order. Per-item faults are recorded, never thrown, except the fatal
     * rate-limit error, which ends the batch after what was already attempted is kept.
     */
    private BatchOutcome processBatch(List<String> slice, RunContext run) {
        BatchTally tally = new BatchTally(operationType);
        boolean interrupted = false;
        RateLimitExceededException fatal = null;

        for (String item : slice) {
            if (shutdownSignal.shouldStop(run.attempted)) {
                interrupted = true;
                break;
            }
            Optional<String> rejection = validator.validate(item);
            if (rejection.isPresent()) {
                LOGGER.debug("Skipping invalid item {}: {}", item, rejection.get());
                tally.attempted(item);
                tally.invalid(item);
                run.attempted++;
                continue;
            }
            try {
                ItemOutcome outcome = operation.process(item);
                if (!outcome.isSuccess()) {
                    LOGGER.debug("{} for {}: {}", outcome.kind(), item, outcome.reason());
                }
                tally.attempted(item);
                tally.outcome(item, outcome);
            } catch (RateLimitExceededException ex) {
                fatal = ex;
                break;
            } catch (InterruptedException ex) {
                // The call was cut short, so the item stays in remaining_items for the next run.
                run.threadInterrupted = true;
                interrupted = true;
                break;
            } catch (Exception ex) {
                LOGGER.warn("{} failed for item {}: {}", operationType.value(), item, ex.getMessage());
                tally.attempted(item);
                tally.error(item, ex, clock.instant());
            }
            run.attempted++;
        }
        return new BatchOutcome(tally.toResults(), tally.attemptedItems(), interrupted, fatal);
    }

    private Optional<String> interrupt(RunContext run, String reason) throws CheckpointPersistenceException {
        LOGGER.warn(reason);
        run.checkpoint = checkpointManager.save(checkpointManager.markCancelled(run.checkpoint, reason));
        LOGGER.info("You can resume this operation later with: resume {}", run.checkpoint.id());
        return Optional.of(run.checkpoint.id());
    }

    private void logSummary(String name, RunContext run) {
        ProcessingResults totals = run.totals;
        LOGGER.info("{} summary: processed={}, skipped={}, errors={}, not found={}, multiple matches={}",
                name, totals.processedCount(), totals.skippedCount(), totals.errorCount(), totals.notFoundCount(),
                totals.multipleMatchesCount());
        ProcessingResults overall = run.checkpoint.results();
        LOGGER.info("Checkpoint {} overall: {}/{} attempted, success rate {}%", run.checkpoint.id(),
                run.checkpoint.progress().currentItem(), run.checkpoint.progress().totalItems(),
                String.format("%.1f", overall.successRate()));
    }

    private String operationName(Checkpoint checkpoint) {
        String name = checkpoint.config().operationName();
        return name == null || name.isBlank() ? operationType.value() : name;
    }

    private static String describe(Exception ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private static final class RunContext {
        private Checkpoint checkpoint;
        private ProcessingResults totals = ProcessingResults.empty();
        private long attempted;
        private boolean threadInterrupted;

        private RunContext(Checkpoint checkpoint) {
            this.checkpoint = checkpoint;
        }
    }
}
