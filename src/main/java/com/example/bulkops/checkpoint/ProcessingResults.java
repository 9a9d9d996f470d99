package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome counters and details for a bulk operation, or for one batch of it when used as a delta.
 * Counters only ever grow; {@link #merge(ProcessingResults)} is how batches accumulate.
 */
public record ProcessingResults(
        @JsonProperty("processed_count") long processedCount,
        @JsonProperty("skipped_count") long skippedCount,
        @JsonProperty("error_count") long errorCount,
        @JsonProperty("not_found_count") long notFoundCount,
        @JsonProperty("multiple_matches_count") long multipleMatchesCount,
        @JsonProperty("not_found_items") List<String> notFoundItems,
        @JsonProperty("invalid_items") List<String> invalidItems,
        @JsonProperty("multiple_matches") Map<String, List<String>> multipleMatches,
        @JsonProperty("errors") List<ErrorRecord> errors
) {
    public ProcessingResults {
        notFoundItems = notFoundItems == null ? List.of() : List.copyOf(notFoundItems);
        invalidItems = invalidItems == null ? List.of() : List.copyOf(invalidItems);
        errors = errors == null ? List.of() : List.copyOf(errors);
        Map<String, List<String>> matches = new LinkedHashMap<>();
        if (multipleMatches != null) {
            multipleMatches.forEach((item, candidates) -> matches.put(item, List.copyOf(candidates)));
        }
        multipleMatches = Collections.unmodifiableMap(matches);
    }

    public static ProcessingResults empty() {
        return new ProcessingResults(0, 0, 0, 0, 0, List.of(), List.of(), Map.of(), List.of());
    }

    public ProcessingResults merge(ProcessingResults other) {
        Map<String, List<String>> matches = new LinkedHashMap<>(multipleMatches);
        matches.putAll(other.multipleMatches);
        return new ProcessingResults(
                processedCount + other.processedCount,
                skippedCount + other.skippedCount,
                errorCount + other.errorCount,
                notFoundCount + other.notFoundCount,
                multipleMatchesCount + other.multipleMatchesCount,
                concat(notFoundItems, other.notFoundItems),
                concat(invalidItems, other.invalidItems),
                matches,
                concat(errors, other.errors)
        );
    }

    public ProcessingResults withError(ErrorRecord error, boolean countIt) {
        return new ProcessingResults(
                processedCount,
                skippedCount,
                countIt ? errorCount + 1 : errorCount,
                notFoundCount,
                multipleMatchesCount,
                notFoundItems,
                invalidItems,
                multipleMatches,
                concat(errors, List.of(error))
        );
    }

    /**
     * Percentage of handled items that succeeded; 0 when nothing has been handled yet.
     */
    public double successRate() {
        long handled = processedCount + skippedCount + errorCount;
        if (handled == 0) {
            return 0.0;
        }
        return (double) processedCount / handled * 100.0;
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        if (second.isEmpty()) {
            return first;
        }
        List<T> merged = new ArrayList<>(first.size() + second.size());
        merged.addAll(first);
        merged.addAll(second);
        return merged;
    }
}
