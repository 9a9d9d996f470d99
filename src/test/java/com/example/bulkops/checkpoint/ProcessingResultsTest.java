package com.example.bulkops.checkpoint;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProcessingResultsTest {
    private static final Instant NOW = Instant.parse("2024-03-05T10:15:30Z");

    private final ProcessingResults first = new ProcessingResults(3, 1, 0, 1, 0,
            List.of("nf-1"), List.of(), Map.of(), List.of());
    private final ProcessingResults second = new ProcessingResults(1, 2, 1, 0, 1,
            List.of(), List.of("bad"), Map.of("dup", List.of("x", "y")),
            List.of(ErrorRecord.forItem("err", "HTTP 500", OperationType.BATCH_DELETE, NOW)));
    private final ProcessingResults third = new ProcessingResults(0, 0, 2, 0, 0,
            List.of(), List.of(), Map.of(),
            List.of(ErrorRecord.forItem("e1", "timeout", OperationType.BATCH_DELETE, NOW),
                    ErrorRecord.forItem("e2", "timeout", OperationType.BATCH_DELETE, NOW)));

    @Test
    void mergeIsAssociative() {
        assertEquals(first.merge(second).merge(third), first.merge(second.merge(third)));
    }

    @Test
    void mergedCountersDoNotDependOnOrder() {
        ProcessingResults forward = first.merge(second);
        ProcessingResults backward = second.merge(first);

        assertEquals(forward.processedCount(), backward.processedCount());
        assertEquals(forward.skippedCount(), backward.skippedCount());
        assertEquals(forward.errorCount(), backward.errorCount());
        assertEquals(forward.notFoundCount(), backward.notFoundCount());
        assertEquals(forward.multipleMatchesCount(), backward.multipleMatchesCount());
        assertEquals(forward.multipleMatches(), backward.multipleMatches());
    }

    @Test
    void emptyIsIdentity() {
        assertEquals(second, ProcessingResults.empty().merge(second));
        assertEquals(second, second.merge(ProcessingResults.empty()));
    }

    @Test
    void mergeSumsCountersAndConcatenatesDetails() {
        ProcessingResults merged = first.merge(second).merge(third);

        assertEquals(4L, merged.processedCount());
        assertEquals(3L, merged.skippedCount());
        assertEquals(3L, merged.errorCount());
        assertEquals(List.of("nf-1"), merged.notFoundItems());
        assertEquals(List.of("bad"), merged.invalidItems());
        assertEquals(List.of("err", "e1", "e2"), merged.errors().stream().map(ErrorRecord::item).toList());
    }

    @Test
    void successRateIsShareOfHandledItems() {
        assertEquals(0.0, ProcessingResults.empty().successRate(), 0.0001);
        assertEquals(75.0, first.successRate(), 0.0001);
        assertEquals(40.0, first.merge(second).merge(third).successRate(), 0.0001);
    }

    @Test
    void runLevelErrorCountsOnlyWhenAsked() {
        ErrorRecord error = ErrorRecord.forRun("stopped", OperationType.BATCH_DELETE, NOW);

        assertEquals(1L, first.withError(error, true).errorCount());
        assertEquals(0L, first.withError(error, false).errorCount());
        assertEquals(1, first.withError(error, false).errors().size());
    }
}
