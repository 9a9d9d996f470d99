package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointStoreTest {
    @Test
    void savedCheckpointLoadsBackEqual() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("cp.json");
        CheckpointStore store = new CheckpointStore();
        Instant now = Instant.parse("2024-03-05T10:15:30.123456Z");
        ProcessingResults results = new ProcessingResults(2, 2, 1, 1, 1,
                List.of("b"), List.of(), Map.of("c", List.of("auth0|1", "google|2")),
                List.of(ErrorRecord.forItem("d", "HTTP 500", OperationType.BATCH_BLOCK, now)));
        Checkpoint checkpoint = new Checkpoint("cp", OperationType.BATCH_BLOCK, CheckpointStatus.CANCELLED, now, now,
                new OperationConfig("prod", "in.txt", "out.jsonl", null, true, false, 2, "block", Map.of("k", "v")),
                new BatchProgress(3, 4, 5, 7, 2), results, List.of("f", "g"), List.of("a", "b", "c", "d", "e"),
                Checkpoint.CURRENT_VERSION);

        store.save(checkpoint, file);

        assertEquals(checkpoint, store.load(file));
    }

    @Test
    void writesSnakeCaseFieldsAndIsoTimestamps() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("cp.json");
        Instant now = Instant.parse("2024-03-05T10:15:30Z");
        new CheckpointStore().save(new Checkpoint("cp", OperationType.BATCH_DELETE, CheckpointStatus.ACTIVE, now, now,
                null, BatchProgress.start(1, 1), null, List.of("a"), List.of(), Checkpoint.CURRENT_VERSION), file);

        JsonNode tree = new ObjectMapper().readTree(file.toFile());
        assertEquals("batch_delete", tree.get("operation_type").asText());
        assertEquals("active", tree.get("status").asText());
        assertEquals("2024-03-05T10:15:30Z", tree.get("created_at").asText());
        assertEquals(1, tree.get("progress").get("total_batches").asInt());
        assertTrue(tree.get("results").has("not_found_items"));
        assertTrue(tree.has("remaining_items"));
        assertEquals("1.0.0", tree.get("version").asText());
    }

    @Test
    void overwriteKeepsBackupOfPreviousVersion() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("cp.json");
        CheckpointStore store = new CheckpointStore();
        Checkpoint first = sample("cp", "dev");
        store.save(first, file);
        store.save(first.withStatus(CheckpointStatus.FAILED, Instant.now()), file);

        Path backup = CheckpointStore.backupPathFor(file);
        assertTrue(Files.exists(backup));
        assertEquals(CheckpointStatus.ACTIVE, store.load(backup).status());
        assertEquals(CheckpointStatus.FAILED, store.load(file).status());
    }

    @Test
    void failedWriteRestoresPreviousVersion() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("cp.json");
        SimpleModule failing = new SimpleModule();
        failing.addSerializer(OperationConfig.class, new JsonSerializer<OperationConfig>() {
            @Override
            public void serialize(OperationConfig value, JsonGenerator gen, SerializerProvider serializers)
                    throws IOException {
                if ("boom".equals(value.environment())) {
                    throw new IOException("simulated write failure");
                }
                gen.writeStartObject();
                gen.writeStringField("environment", value.environment());
                gen.writeEndObject();
            }
        });
        CheckpointStore store = new CheckpointStore(CheckpointStore.defaultMapper().registerModule(failing));
        store.save(sample("cp", "dev"), file);

        CheckpointPersistenceException error = assertThrows(CheckpointPersistenceException.class,
                () -> store.save(sample("cp", "boom"), file));

        assertTrue(error.backupRestored());
        assertEquals("cp", error.checkpointId());
        assertEquals("dev", store.load(file).config().environment());
    }

    @Test
    void rejectsDocumentsMissingRequiredFields() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("broken.json");
        Files.writeString(file, "{\"id\": \"broken\", \"status\": \"active\", \"created_at\": \"2024-01-01T00:00:00Z\"}");

        MalformedCheckpointException error = assertThrows(MalformedCheckpointException.class,
                () -> new CheckpointStore().load(file));

        assertEquals(List.of("operation_type", "updated_at"), error.missingFields());
        assertEquals("broken", error.checkpointId());
    }

    @Test
    void rejectsUnparseableDocuments() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("garbage.json");
        Files.writeString(file, "{not json");

        assertThrows(MalformedCheckpointException.class, () -> new CheckpointStore().load(file));
    }

    @Test
    void missingFileIsReportedAsNotFound() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("absent.json");

        CheckpointNotFoundException error = assertThrows(CheckpointNotFoundException.class,
                () -> new CheckpointStore().load(file));
        assertEquals("absent", error.checkpointId());
    }

    @Test
    void fillsDefaultsForOptionalSections() throws Exception {
        Path file = Files.createTempDirectory("store-test").resolve("minimal.json");
        Files.writeString(file, "{\"operation_type\": \"batch_delete\","
                + " \"created_at\": \"2024-01-01T00:00:00Z\","
                + " \"updated_at\": \"2024-01-01T00:00:00Z\","
                + " \"remaining_items\": [\"a\", \"b\"],"
                + " \"some_future_field\": 1}");

        Checkpoint checkpoint = new CheckpointStore().load(file);

        assertEquals("minimal", checkpoint.id());
        assertEquals(CheckpointStatus.ACTIVE, checkpoint.status());
        assertEquals("dev", checkpoint.config().environment());
        assertEquals(2, checkpoint.progress().totalItems());
        assertEquals(0L, checkpoint.results().processedCount());
        assertEquals(Checkpoint.LEGACY_VERSION, checkpoint.version());
        assertFalse(checkpoint.resumable());
    }

    private static Checkpoint sample(String id, String environment) {
        Instant now = Instant.parse("2024-03-05T10:15:30Z");
        return new Checkpoint(id, OperationType.BATCH_DELETE, CheckpointStatus.ACTIVE, now, now,
                OperationConfig.forEnvironment(environment), BatchProgress.start(2, 1), ProcessingResults.empty(),
                List.of("a", "b"), List.of(), Checkpoint.CURRENT_VERSION);
    }
}
