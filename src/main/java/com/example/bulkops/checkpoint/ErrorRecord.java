package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Timestamped failure entry kept in {@link ProcessingResults#errors()}. {@code item} is null for
 * run-level failures and cancellations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorRecord(
        String item,
        String message,
        String operation,
        Instant timestamp
) {
    public static ErrorRecord forItem(String item, String message, OperationType operation, Instant timestamp) {
        return new ErrorRecord(item, message, operation.value(), timestamp);
    }

    public static ErrorRecord forRun(String message, OperationType operation, Instant timestamp) {
        return new ErrorRecord(null, message, operation.value(), timestamp);
    }
}
