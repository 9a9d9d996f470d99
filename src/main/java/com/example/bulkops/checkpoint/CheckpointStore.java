package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes single checkpoint documents as pretty-printed JSON.
 *
 * <p>Saving keeps a {@code .backup} copy of the previous document and puts it back if the new write
 * fails, so an interrupted write never leaves a truncated file as the only copy. This is best effort:
 * there is no fsync and no locking.
 */
public class CheckpointStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointStore.class);
    public static final String BACKUP_SUFFIX = ".backup";
    private static final List<String> REQUIRED_FIELDS = List.of("operation_type", "created_at", "updated_at");

    private final ObjectMapper mapper;

    public CheckpointStore() {
        this(defaultMapper());
    }

    public CheckpointStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static Path backupPathFor(Path path) {
        return path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
    }

    /**
     * Writes the checkpoint to {@code path}, creating parent directories as needed.
     */
    public void save(Checkpoint checkpoint, Path path) throws CheckpointPersistenceException {
        Path backup = backupPathFor(path);
        boolean backedUp = false;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(path)) {
                backedUp = backup(path, backup);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), checkpoint);
        } catch (IOException | RuntimeException ex) {
            boolean restored = backedUp && restore(backup, path);
            throw new CheckpointPersistenceException(checkpoint.id(), restored, ex);
        }
    }

    /**
     * Reads the checkpoint at {@code path}. Unlike listing, this never tolerates a bad document.
     */
    public Checkpoint load(Path path) throws CheckpointException {
        String name = idFromPath(path);
        JsonNode tree;
        try (Reader reader = Files.newBufferedReader(path)) {
            tree = mapper.readTree(reader);
        } catch (NoSuchFileException ex) {
            throw new CheckpointNotFoundException(name);
        } catch (JsonProcessingException ex) {
            throw new MalformedCheckpointException(name, ex);
        } catch (IOException ex) {
            throw new CheckpointException("Failed to read checkpoint " + name, name, ex);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedCheckpointException(name, REQUIRED_FIELDS);
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = tree.get(field);
            if (value == null || value.isNull()) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new MalformedCheckpointException(name, missing);
        }

        try {
            Checkpoint checkpoint = mapper.treeToValue(tree, Checkpoint.class);
            if (checkpoint.id() == null || checkpoint.id().isBlank()) {
                return new Checkpoint(name, checkpoint.operationType(), checkpoint.status(), checkpoint.createdAt(),
                        checkpoint.updatedAt(), checkpoint.config(), checkpoint.progress(), checkpoint.results(),
                        checkpoint.remainingItems(), checkpoint.processedItems(), checkpoint.version());
            }
            return checkpoint;
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new MalformedCheckpointException(name, ex);
        }
    }

    private boolean backup(Path path, Path backup) {
        try {
            Files.copy(path, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Could not back up {} before overwriting it; continuing without a backup", path, ex);
            return false;
        }
    }

    private boolean restore(Path backup, Path path) {
        try {
            Files.copy(backup, path, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.warn("Restored {} from backup after a failed write", path);
            return true;
        } catch (IOException ex) {
            LOGGER.error("Failed to restore {} from backup {}", path, backup, ex);
            return false;
        }
    }

    static String idFromPath(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - ".json".length()) : fileName;
    }
}
