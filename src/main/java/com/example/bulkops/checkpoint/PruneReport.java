package com.example.bulkops.checkpoint;

import java.util.List;

/**
 * Result of a cleanup pass. In a dry run {@code deletedCount} is zero and {@code matchedIds} lists
 * what would have been removed.
 */
public record PruneReport(List<String> matchedIds, int deletedCount, boolean dryRun) {
    public PruneReport {
        matchedIds = List.copyOf(matchedIds);
    }

    /**
     * Count reported to the operator: matches for a dry run, actual deletions otherwise.
     */
    public int count() {
        return dryRun ? matchedIds.size() : deletedCount;
    }
}
