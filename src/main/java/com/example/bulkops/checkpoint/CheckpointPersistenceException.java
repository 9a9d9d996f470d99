package com.example.bulkops.checkpoint;

public class CheckpointPersistenceException extends CheckpointException {
    private final boolean backupRestored;

    public CheckpointPersistenceException(String checkpointId, boolean backupRestored, Throwable cause) {
        super("Failed to save checkpoint " + checkpointId
                + (backupRestored ? " (previous version restored from backup)" : ""), checkpointId, cause);
        this.backupRestored = backupRestored;
    }

    public boolean backupRestored() {
        return backupRestored;
    }
}
