package com.example.bulkops;

import com.example.bulkops.checkpoint.ProcessingResults;
import com.example.bulkops.ratelimit.RateLimitExceededException;

import java.util.List;

/**
 * What one pass over a batch slice produced. {@code attempted} is what leaves {@code remaining_items},
 * regardless of how each item was classified.
 */
record BatchOutcome(
        ProcessingResults delta,
        List<String> attempted,
        boolean interrupted,
        RateLimitExceededException fatal
) {
}
