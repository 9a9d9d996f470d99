package com.example.bulkops;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pre-check run on each item before the operation is invoked. A rejected item is recorded as
 * invalid and the operation never sees it.
 */
@FunctionalInterface
public interface ItemValidator {
    /**
     * Returns the rejection reason, or empty when the item may be processed.
     */
    Optional<String> validate(String item);

    ItemValidator ACCEPT_ALL = item -> Optional.empty();

    static ItemValidator nonBlank() {
        return item -> item == null || item.isBlank() ? Optional.of("blank identifier") : Optional.empty();
    }

    static ItemValidator matching(Pattern pattern) {
        return item -> {
            if (item == null || item.isBlank()) {
                return Optional.of("blank identifier");
            }
            return pattern.matcher(item).matches()
                    ? Optional.empty()
                    : Optional.of("does not match " + pattern.pattern());
        };
    }
}
