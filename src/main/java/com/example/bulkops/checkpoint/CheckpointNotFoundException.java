package com.example.bulkops.checkpoint;

public class CheckpointNotFoundException extends CheckpointException {
    public CheckpointNotFoundException(String checkpointId) {
        super("Checkpoint not found: " + checkpointId, checkpointId);
    }
}
