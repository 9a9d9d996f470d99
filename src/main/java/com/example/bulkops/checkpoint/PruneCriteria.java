package com.example.bulkops.checkpoint;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Selects checkpoints for cleanup.
 */
public record PruneCriteria(Kind kind, int olderThanDays) {
    public enum Kind {
        ALL,
        FAILED,
        COMPLETED,
        OLDER_THAN
    }

    public static final int DEFAULT_DAYS = 30;
    private static final Set<CheckpointStatus> AGED_OUT_STATUSES =
            Set.of(CheckpointStatus.COMPLETED, CheckpointStatus.FAILED, CheckpointStatus.CANCELLED);

    public PruneCriteria {
        if (kind == null) {
            throw new IllegalArgumentException("Prune kind is required");
        }
        if (kind == Kind.OLDER_THAN && olderThanDays < 0) {
            throw new IllegalArgumentException("Days must not be negative: " + olderThanDays);
        }
    }

    public static PruneCriteria all() {
        return new PruneCriteria(Kind.ALL, 0);
    }

    public static PruneCriteria failed() {
        return new PruneCriteria(Kind.FAILED, 0);
    }

    public static PruneCriteria completed() {
        return new PruneCriteria(Kind.COMPLETED, 0);
    }

    public static PruneCriteria olderThan(int days) {
        return new PruneCriteria(Kind.OLDER_THAN, days);
    }

    /**
     * Age-based cleanup never touches active checkpoints, however old.
     */
    boolean matches(Checkpoint checkpoint, Instant now) {
        if (kind == Kind.ALL) {
            return true;
        }
        if (kind == Kind.FAILED) {
            return checkpoint.status() == CheckpointStatus.FAILED;
        }
        if (kind == Kind.COMPLETED) {
            return checkpoint.status() == CheckpointStatus.COMPLETED;
        }
        return AGED_OUT_STATUSES.contains(checkpoint.status())
                && checkpoint.createdAt().isBefore(now.minus(Duration.ofDays(olderThanDays)));
    }
}
