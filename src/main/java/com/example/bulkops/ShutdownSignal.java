package com.example.bulkops;

import java.util.function.BooleanSupplier;

/**
 * Cooperative stop request polled by the engine between items and between batches. Passed in
 * explicitly so separate runs, and tests, never share a flag.
 */
@FunctionalInterface
public interface ShutdownSignal {
    /**
     * Returns true if processing should stop before the next item.
     *
     * @param attemptedThisRun items handed to the operation so far in this process
     */
    boolean shouldStop(long attemptedThisRun);

    /**
     * Never stops early.
     */
    ShutdownSignal NEVER = attempted -> false;

    static ShutdownSignal when(BooleanSupplier flag) {
        return attempted -> flag.getAsBoolean();
    }
}
