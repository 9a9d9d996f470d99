package com.example.bulkops.checkpoint;

import java.util.List;

/**
 * Raised when a checkpoint document cannot be parsed or lacks the fields needed to resume it.
 */
public class MalformedCheckpointException extends CheckpointException {
    private final List<String> missingFields;

    public MalformedCheckpointException(String checkpointId, List<String> missingFields) {
        super("Malformed checkpoint " + checkpointId + ": missing " + String.join(", ", missingFields), checkpointId);
        this.missingFields = List.copyOf(missingFields);
    }

    public MalformedCheckpointException(String checkpointId, Throwable cause) {
        super("Malformed checkpoint " + checkpointId + ": " + cause.getMessage(), checkpointId, cause);
        this.missingFields = List.of();
    }

    public List<String> missingFields() {
        return missingFields;
    }
}
