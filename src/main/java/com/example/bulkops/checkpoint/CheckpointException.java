package com.example.bulkops.checkpoint;

import java.io.IOException;

/**
 * Base type for checkpoint persistence and lifecycle failures.
 */
public class CheckpointException extends IOException {
    private final String checkpointId;

    public CheckpointException(String message, String checkpointId) {
        super(message);
        this.checkpointId = checkpointId;
    }

    public CheckpointException(String message, String checkpointId, Throwable cause) {
        super(message, cause);
        this.checkpointId = checkpointId;
    }

    /**
     * Id of the checkpoint involved, or the file name when the id could not be read.
     */
    public String checkpointId() {
        return checkpointId;
    }
}
