package com.example.bulkops.checkpoint;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointManagerTest {
    private static final Instant NOW = Instant.parse("2024-03-05T10:15:30Z");

    @Test
    void createsActiveCheckpointWithCeilingBatchCount() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);

        Checkpoint checkpoint = manager.create(OperationType.BATCH_DELETE, OperationConfig.forEnvironment("prod"),
                List.of("a", "b", "c", "d", "e", "f", "g"), 3);

        assertTrue(checkpoint.id().matches("batch_delete_prod_20240305_101530_[0-9a-f]{8}"));
        assertEquals(CheckpointStatus.ACTIVE, checkpoint.status());
        assertEquals(3, checkpoint.progress().totalBatches());
        assertEquals(7, checkpoint.progress().totalItems());
        assertEquals(0, checkpoint.progress().currentBatch());
        assertEquals(7, checkpoint.remainingItems().size());
        assertTrue(checkpoint.processedItems().isEmpty());
        assertEquals(NOW, checkpoint.createdAt());
        assertFalse(Files.exists(manager.pathFor(checkpoint.id())));
    }

    @Test
    void dropsDuplicateIdentifiersKeepingFirstOccurrence() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);

        Checkpoint checkpoint = manager.create(OperationType.BATCH_BLOCK, OperationConfig.forEnvironment("dev"),
                List.of("a", "b", "a", "c", "b"), 2);

        assertEquals(List.of("a", "b", "c"), checkpoint.remainingItems());
        assertEquals(3, checkpoint.progress().totalItems());
        assertEquals(2, checkpoint.progress().totalBatches());
    }

    @Test
    void rejectsNonPositiveBatchSizeAndMissingExportTarget() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);

        assertThrows(IllegalArgumentException.class, () -> manager.create(OperationType.BATCH_DELETE,
                OperationConfig.forEnvironment("dev"), List.of("a"), 0));
        assertThrows(IllegalArgumentException.class, () -> manager.create(OperationType.EXPORT_LAST_LOGIN,
                OperationConfig.forEnvironment("dev"), List.of("a"), 5));
        Checkpoint export = manager.create(OperationType.EXPORT_LAST_LOGIN,
                OperationConfig.forEnvironment("dev").withOutputFile("out.jsonl"), List.of("a"), 5);
        assertEquals("out.jsonl", export.config().outputFile());
    }

    @Test
    void applyingBatchesKeepsItemsAccountedFor() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);
        List<String> items = List.of("a", "b", "c", "d", "e");
        Checkpoint checkpoint = manager.create(OperationType.BATCH_DELETE, OperationConfig.forEnvironment("dev"),
                items, 2);

        ProcessingResults delta = new ProcessingResults(1, 1, 0, 1, 0, List.of("b"), List.of(), Map.of(), List.of());
        Checkpoint afterFirst = manager.applyBatch(checkpoint, List.of("a", "b"), delta);

        assertEquals(List.of("a", "b"), afterFirst.processedItems());
        assertEquals(List.of("c", "d", "e"), afterFirst.remainingItems());
        assertEquals(items.size(), afterFirst.processedItems().size() + afterFirst.remainingItems().size());
        assertEquals(1, afterFirst.progress().currentBatch());
        assertEquals(2, afterFirst.progress().currentItem());
        assertEquals(40.0, afterFirst.completionPercentage(), 0.0001);
        assertEquals(1L, afterFirst.results().notFoundCount());
        assertEquals(CheckpointStatus.ACTIVE, afterFirst.status());

        Checkpoint done = manager.applyBatch(manager.applyBatch(afterFirst, List.of("c", "d"), ProcessingResults.empty()),
                List.of("e"), ProcessingResults.empty());
        assertEquals(items, done.processedItems());
        assertTrue(done.remainingItems().isEmpty());
        assertEquals(CheckpointStatus.COMPLETED, done.status());
        assertEquals(3, done.progress().currentBatch());
    }

    @Test
    void savedCheckpointLoadsAndMissingOneIsEmpty() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);
        Checkpoint checkpoint = manager.save(manager.create(OperationType.BATCH_DELETE,
                OperationConfig.forEnvironment("dev"), List.of("a"), 1));

        assertEquals(checkpoint, manager.load(checkpoint.id()).orElseThrow());
        assertTrue(manager.load("missing").isEmpty());
        assertThrows(CheckpointNotFoundException.class, () -> manager.require("missing"));
        assertTrue(manager.sizeOf(checkpoint.id()) > 0);
        assertEquals(0L, manager.sizeOf("missing"));
    }

    @Test
    void listsNewestFirstWithFilterAndSkipsUnreadableFiles() throws Exception {
        Path directory = Files.createTempDirectory("manager-test");
        CheckpointManager earliest = manager(directory, NOW.minus(Duration.ofHours(2)));
        Checkpoint older = earliest.save(earliest.create(OperationType.BATCH_DELETE,
                OperationConfig.forEnvironment("dev"), List.of("a"), 1));
        CheckpointManager later = manager(directory, NOW.minus(Duration.ofHours(1)));
        Checkpoint middle = later.save(later.create(OperationType.BATCH_BLOCK, OperationConfig.forEnvironment("prod"),
                List.of("a"), 1));
        CheckpointManager latest = manager(directory, NOW);
        Checkpoint newest = latest.save(latest.markFailed(latest.create(OperationType.BATCH_DELETE,
                OperationConfig.forEnvironment("dev"), List.of("a"), 1), "boom"));
        Files.writeString(directory.resolve("junk.json"), "{ broken");

        List<Checkpoint> all = latest.list(CheckpointFilter.ALL);
        assertEquals(List.of(newest.id(), middle.id(), older.id()), all.stream().map(Checkpoint::id).toList());

        assertEquals(List.of(newest.id(), older.id()),
                latest.list(new CheckpointFilter(OperationType.BATCH_DELETE, null, null)).stream()
                        .map(Checkpoint::id).toList());
        assertEquals(List.of(middle.id()), latest.list(new CheckpointFilter(null, null, "prod")).stream()
                .map(Checkpoint::id).toList());
        assertEquals(List.of(newest.id()), latest.list(CheckpointFilter.byStatus(CheckpointStatus.FAILED)).stream()
                .map(Checkpoint::id).toList());
    }

    @Test
    void listOfMissingDirectoryIsEmpty() throws Exception {
        Path directory = Files.createTempDirectory("manager-test").resolve("absent");

        CheckpointManager manager = manager(directory, NOW);

        assertTrue(manager.list(CheckpointFilter.ALL).isEmpty());
        assertEquals(0L, manager.totalSize());
    }

    @Test
    void deleteRemovesCheckpointAndBackup() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);
        Checkpoint checkpoint = manager.save(manager.create(OperationType.BATCH_DELETE,
                OperationConfig.forEnvironment("dev"), List.of("a", "b"), 1));
        manager.save(checkpoint);
        Path backup = CheckpointStore.backupPathFor(manager.pathFor(checkpoint.id()));
        assertTrue(Files.exists(backup));

        assertTrue(manager.delete(checkpoint.id()));
        assertFalse(Files.exists(manager.pathFor(checkpoint.id())));
        assertFalse(Files.exists(backup));
        assertFalse(manager.delete(checkpoint.id()));
    }

    @Test
    void failedAndCancelledCheckpointsCanBeReactivated() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);
        Checkpoint checkpoint = manager.create(OperationType.BATCH_DELETE, OperationConfig.forEnvironment("dev"),
                List.of("a", "b"), 1);

        Checkpoint failed = manager.markFailed(checkpoint, "network down");
        assertEquals(CheckpointStatus.FAILED, failed.status());
        assertEquals(1L, failed.results().errorCount());
        assertEquals("network down", failed.results().errors().get(0).message());
        assertEquals(checkpoint.remainingItems(), failed.remainingItems());
        assertTrue(failed.resumable());

        Checkpoint cancelled = manager.markCancelled(checkpoint, "operator stop");
        assertEquals(CheckpointStatus.CANCELLED, cancelled.status());
        assertEquals(0L, cancelled.results().errorCount());
        assertEquals(1, cancelled.results().errors().size());

        Checkpoint active = manager.reactivate(failed);
        assertEquals(CheckpointStatus.ACTIVE, active.status());
        assertEquals(CheckpointStatus.ACTIVE, manager.require(active.id()).status());

        Checkpoint completed = manager.complete(active);
        assertFalse(completed.resumable());
        assertEquals(completed, manager.reactivate(completed));
    }

    @Test
    void pruneHonoursCriteriaAndDryRun() throws Exception {
        Path directory = Files.createTempDirectory("manager-test");
        CheckpointManager old = manager(directory, NOW.minus(Duration.ofDays(40)));
        Checkpoint oldCompleted = old.complete(old.create(OperationType.BATCH_DELETE,
                OperationConfig.forEnvironment("dev"), List.of("a"), 1));
        Checkpoint oldActive = old.save(old.create(OperationType.BATCH_DELETE,
                OperationConfig.forEnvironment("dev"), List.of("a"), 1));
        CheckpointManager manager = manager(directory, NOW);
        Checkpoint recentFailed = manager.save(manager.markFailed(manager.create(OperationType.BATCH_BLOCK,
                OperationConfig.forEnvironment("dev"), List.of("a"), 1), "boom"));

        PruneReport dryRun = manager.prune(PruneCriteria.olderThan(30), true);
        assertEquals(List.of(oldCompleted.id()), dryRun.matchedIds());
        assertEquals(0, dryRun.deletedCount());
        assertTrue(Files.exists(manager.pathFor(oldCompleted.id())));

        PruneReport failed = manager.prune(PruneCriteria.failed(), false);
        assertEquals(List.of(recentFailed.id()), failed.matchedIds());
        assertEquals(1, failed.deletedCount());
        assertFalse(Files.exists(manager.pathFor(recentFailed.id())));

        PruneReport aged = manager.prune(PruneCriteria.olderThan(30), false);
        assertEquals(1, aged.deletedCount());
        assertTrue(Files.exists(manager.pathFor(oldActive.id())));

        assertEquals(1, manager.prune(PruneCriteria.all(), false).deletedCount());
        assertTrue(manager.list(CheckpointFilter.ALL).isEmpty());
    }

    @Test
    void backupCopiesExistingCheckpointOnly() throws Exception {
        CheckpointManager manager = manager(Files.createTempDirectory("manager-test"), NOW);
        Checkpoint checkpoint = manager.save(manager.create(OperationType.CHECK_DOMAINS,
                OperationConfig.forEnvironment("dev"), List.of("a"), 1));

        assertTrue(manager.backup(checkpoint.id()));
        assertTrue(Files.exists(CheckpointStore.backupPathFor(manager.pathFor(checkpoint.id()))));
        assertFalse(manager.backup("missing"));
    }

    private static CheckpointManager manager(Path directory, Instant now) {
        return new CheckpointManager(directory, new CheckpointStore(), Clock.fixed(now, ZoneOffset.UTC));
    }
}
