package com.example.bulkops.checkpoint;

public class CheckpointNotResumableException extends CheckpointException {
    public CheckpointNotResumableException(String checkpointId, String reason) {
        super("Checkpoint " + checkpointId + " cannot be resumed: " + reason, checkpointId);
    }
}
