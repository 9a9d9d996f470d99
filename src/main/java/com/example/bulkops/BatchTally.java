package com.example.bulkops;

import com.example.bulkops.checkpoint.ErrorRecord;
import com.example.bulkops.checkpoint.OperationType;
import com.example.bulkops.checkpoint.ProcessingResults;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-batch accumulator; {@link #toResults()} turns it into the delta merged into the checkpoint.
 */
final class BatchTally {
    private final OperationType operationType;
    private final List<String> attempted = new ArrayList<>();
    private final List<String> notFound = new ArrayList<>();
    private final List<String> invalid = new ArrayList<>();
    private final Map<String, List<String>> multipleMatches = new LinkedHashMap<>();
    private final List<ErrorRecord> errors = new ArrayList<>();
    private long processed;
    private long skipped;
    private long errorCount;

    BatchTally(OperationType operationType) {
        this.operationType = operationType;
    }

    void attempted(String item) {
        attempted.add(item);
    }

    void invalid(String item) {
        skipped++;
        invalid.add(item);
    }

    void outcome(String item, ItemOutcome outcome) {
        ItemOutcome.Kind kind = outcome.kind();
        if (kind == ItemOutcome.Kind.SUCCESS) {
            processed++;
            return;
        }
        skipped++;
        if (kind == ItemOutcome.Kind.NOT_FOUND) {
            notFound.add(item);
        } else if (kind == ItemOutcome.Kind.MULTIPLE_MATCHES) {
            multipleMatches.put(item, outcome.candidates());
        }
    }

    void error(String item, Exception ex, Instant timestamp) {
        errorCount++;
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        errors.add(ErrorRecord.forItem(item, message, operationType, timestamp));
    }

    List<String> attemptedItems() {
        return List.copyOf(attempted);
    }

    ProcessingResults toResults() {
        return new ProcessingResults(
                processed,
                skipped,
                errorCount,
                notFound.size(),
                multipleMatches.size(),
                notFound,
                invalid,
                multipleMatches,
                errors
        );
    }
}
