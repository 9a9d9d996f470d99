package com.example.bulkops;

/**
 * The per-item side effect a bulk run applies, such as deleting or blocking one account.
 *
 * <p>Return a business outcome for expected failures (not found, ambiguous match). Throw for
 * technical failures; the engine records the item as an error and moves on. Collaborators such as
 * HTTP clients and the rate governor are constructor-injected into implementations.
 */
@FunctionalInterface
public interface ItemOperation {
    ItemOutcome process(String item) throws Exception;
}
