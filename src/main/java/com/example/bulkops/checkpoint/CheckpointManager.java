package com.example.bulkops.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Lifecycle operations over a directory of checkpoint files: one {@code <id>.json} per bulk operation
 * plus an optional {@code <id>.json.backup} sibling.
 */
public final class CheckpointManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointManager.class);
    public static final Path DEFAULT_DIRECTORY = Path.of(".checkpoints");
    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path directory;
    private final CheckpointStore store;
    private final Clock clock;

    public CheckpointManager(Path directory) {
        this(directory, new CheckpointStore(), Clock.systemDefaultZone());
    }

    public CheckpointManager(Path directory, CheckpointStore store, Clock clock) {
        this.directory = directory;
        this.store = store;
        this.clock = clock;
    }

    public Path directory() {
        return directory;
    }

    public Path pathFor(String checkpointId) {
        return directory.resolve(checkpointId + ".json");
    }

    /**
     * Builds an id of the form {@code <operation>_<environment>_<yyyyMMdd_HHmmss>_<8 hex chars>}.
     */
    public String generateId(OperationType operationType, String environment) {
        String timestamp = ID_TIMESTAMP.format(clock.instant().atZone(clock.getZone()));
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return operationType.value() + "_" + environment + "_" + timestamp + "_" + suffix;
    }

    /**
     * Creates (but does not persist) a fresh active checkpoint over {@code items}. Duplicate
     * identifiers are dropped, keeping the first occurrence, so the item lists stay disjoint.
     */
    public Checkpoint create(OperationType operationType, OperationConfig config, List<String> items, int batchSize) {
        requireOutputFile(operationType, config);
        List<String> unique = List.copyOf(new LinkedHashSet<>(items));
        if (unique.size() != items.size()) {
            LOGGER.warn("Dropped {} duplicate identifiers from the input of {}", items.size() - unique.size(),
                    operationType.value());
        }
        Instant now = clock.instant();
        String id = generateId(operationType, config.environment());
        Checkpoint checkpoint = new Checkpoint(
                id,
                operationType,
                CheckpointStatus.ACTIVE,
                now,
                now,
                config,
                BatchProgress.start(unique.size(), batchSize),
                ProcessingResults.empty(),
                unique,
                List.of(),
                Checkpoint.CURRENT_VERSION
        );
        LOGGER.info("Created checkpoint {} for {} items in {} batches", id, unique.size(),
                checkpoint.progress().totalBatches());
        return checkpoint;
    }

    /**
     * Operations that produce an artifact cannot run without somewhere to write it.
     */
    public static void requireOutputFile(OperationType operationType, OperationConfig config) {
        if (operationType.requiresOutputFile() && config.outputFileIfSet().isEmpty()) {
            throw new IllegalArgumentException(operationType.value() + " requires an output file");
        }
    }

    /**
     * Stamps {@code updated_at}, writes the checkpoint and returns the stamped value.
     */
    public Checkpoint save(Checkpoint checkpoint) throws CheckpointPersistenceException {
        Checkpoint stamped = checkpoint.withUpdatedAt(clock.instant());
        store.save(stamped, pathFor(stamped.id()));
        LOGGER.debug("Checkpoint saved: {}", stamped.id());
        return stamped;
    }

    public Optional<Checkpoint> load(String checkpointId) throws CheckpointException {
        Path path = pathFor(checkpointId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(store.load(path));
    }

    public Checkpoint require(String checkpointId) throws CheckpointException {
        return load(checkpointId).orElseThrow(() -> new CheckpointNotFoundException(checkpointId));
    }

    /**
     * Lists matching checkpoints, newest first. Files that cannot be read are skipped with a warning.
     */
    public List<Checkpoint> list(CheckpointFilter filter) throws IOException {
        List<Checkpoint> checkpoints = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return checkpoints;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : stream) {
                try {
                    Checkpoint checkpoint = store.load(file);
                    if (filter.matches(checkpoint)) {
                        checkpoints.add(checkpoint);
                    }
                } catch (CheckpointException ex) {
                    LOGGER.warn("Skipping unreadable checkpoint file {}: {}", file, ex.getMessage());
                }
            }
        }
        checkpoints.sort(Comparator.comparing(Checkpoint::createdAt).reversed());
        return checkpoints;
    }

    /**
     * Removes the checkpoint and its backup. Returns false if there was nothing to delete.
     */
    public boolean delete(String checkpointId) throws IOException {
        Path path = pathFor(checkpointId);
        boolean deleted = Files.deleteIfExists(path);
        boolean backupDeleted = Files.deleteIfExists(CheckpointStore.backupPathFor(path));
        if (deleted) {
            LOGGER.info("Checkpoint deleted: {}", checkpointId);
        } else if (!backupDeleted) {
            LOGGER.warn("Checkpoint not found: {}", checkpointId);
        }
        return deleted;
    }

    /**
     * Folds one processed batch into the checkpoint. {@code attempted} are the items handed to the
     * operation this batch, whatever their outcome; they leave {@code remaining_items} by value and
     * join {@code processed_items} in order.
     */
    public Checkpoint applyBatch(Checkpoint checkpoint, List<String> attempted, ProcessingResults delta) {
        Set<String> attemptedSet = new HashSet<>(attempted);
        List<String> remaining = checkpoint.remainingItems().stream()
                .filter(item -> !attemptedSet.contains(item))
                .toList();
        Set<String> alreadyProcessed = new HashSet<>(checkpoint.processedItems());
        List<String> processed = new ArrayList<>(checkpoint.processedItems());
        for (String item : new LinkedHashSet<>(attempted)) {
            if (alreadyProcessed.add(item)) {
                processed.add(item);
            }
        }
        CheckpointStatus status = remaining.isEmpty() ? CheckpointStatus.COMPLETED : checkpoint.status();
        return checkpoint.withBatchApplied(
                checkpoint.progress().advance(attempted.size()),
                checkpoint.results().merge(delta),
                remaining,
                processed,
                status,
                clock.instant()
        );
    }

    /**
     * Marks a run-level failure. Item lists are untouched, so the checkpoint can be reactivated.
     */
    public Checkpoint markFailed(Checkpoint checkpoint, String error) {
        Instant now = clock.instant();
        ProcessingResults results = checkpoint.results()
                .withError(ErrorRecord.forRun(error, checkpoint.operationType(), now), true);
        return checkpoint.withResults(results, now).withStatus(CheckpointStatus.FAILED, now);
    }

    public Checkpoint markCancelled(Checkpoint checkpoint, String reason) {
        Instant now = clock.instant();
        ProcessingResults results = checkpoint.results()
                .withError(ErrorRecord.forRun(reason, checkpoint.operationType(), now), false);
        return checkpoint.withResults(results, now).withStatus(CheckpointStatus.CANCELLED, now);
    }

    /**
     * Marks the checkpoint completed and persists it.
     */
    public Checkpoint complete(Checkpoint checkpoint) throws CheckpointPersistenceException {
        Checkpoint completed = save(checkpoint.withStatus(CheckpointStatus.COMPLETED, clock.instant()));
        LOGGER.info("Checkpoint {} completed", completed.id());
        return completed;
    }

    /**
     * Turns a failed or cancelled checkpoint back into an active one and persists it. Other statuses
     * are returned unchanged.
     */
    public Checkpoint reactivate(Checkpoint checkpoint) throws CheckpointPersistenceException {
        if (checkpoint.status() != CheckpointStatus.FAILED && checkpoint.status() != CheckpointStatus.CANCELLED) {
            return checkpoint;
        }
        Checkpoint active = save(checkpoint.withStatus(CheckpointStatus.ACTIVE, clock.instant()));
        LOGGER.info("Checkpoint {} reactivated for resumption", active.id());
        return active;
    }

    public PruneReport prune(PruneCriteria criteria, boolean dryRun) throws IOException {
        Instant now = clock.instant();
        List<String> matched = list(CheckpointFilter.ALL).stream()
                .filter(checkpoint -> criteria.matches(checkpoint, now))
                .map(Checkpoint::id)
                .toList();
        if (dryRun) {
            LOGGER.info("Would delete {} checkpoints: {}", matched.size(), matched);
            return new PruneReport(matched, 0, true);
        }
        int deleted = 0;
        for (String id : matched) {
            if (delete(id)) {
                deleted++;
            }
        }
        LOGGER.info("Cleaned up {} checkpoints ({})", deleted, criteria.kind());
        return new PruneReport(matched, deleted, false);
    }

    /**
     * Size in bytes of the checkpoint file, or 0 if it does not exist.
     */
    public long sizeOf(String checkpointId) throws IOException {
        Path path = pathFor(checkpointId);
        return Files.exists(path) ? Files.size(path) : 0L;
    }

    /**
     * Combined size of all checkpoint and backup files in the directory.
     */
    public long totalSize() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0L;
        }
        long total = 0L;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json*")) {
            for (Path file : stream) {
                total += Files.size(file);
            }
        }
        return total;
    }

    /**
     * Copies the checkpoint to its backup path on demand.
     */
    public boolean backup(String checkpointId) throws IOException {
        Path path = pathFor(checkpointId);
        if (!Files.exists(path)) {
            LOGGER.warn("Checkpoint not found: {}", checkpointId);
            return false;
        }
        Files.copy(path, CheckpointStore.backupPathFor(path), StandardCopyOption.REPLACE_EXISTING);
        LOGGER.info("Checkpoint backed up: {}", checkpointId);
        return true;
    }
}
