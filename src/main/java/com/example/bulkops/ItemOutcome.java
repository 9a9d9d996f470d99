package com.example.bulkops;

import java.util.List;

/**
 * Result of {@link ItemOperation#process(String)} when it did not throw.
 */
public record ItemOutcome(Kind kind, String reason, List<String> candidates) {
    public enum Kind {
        SUCCESS,
        NOT_FOUND,
        MULTIPLE_MATCHES,
        SKIPPED
    }

    private static final ItemOutcome SUCCESS = new ItemOutcome(Kind.SUCCESS, null, List.of());

    public ItemOutcome {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ItemOutcome success() {
        return SUCCESS;
    }

    public static ItemOutcome notFound(String reason) {
        return new ItemOutcome(Kind.NOT_FOUND, reason, List.of());
    }

    /**
     * The identifier resolved to several remote records, so the operation refused to pick one.
     */
    public static ItemOutcome multipleMatches(List<String> candidates) {
        return new ItemOutcome(Kind.MULTIPLE_MATCHES, candidates.size() + " matches", candidates);
    }

    public static ItemOutcome skipped(String reason) {
        return new ItemOutcome(Kind.SKIPPED, reason, List.of());
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
