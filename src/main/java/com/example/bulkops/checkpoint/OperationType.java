package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Bulk operations that can be checkpointed. The JSON value doubles as the checkpoint id prefix.
 */
public enum OperationType {
    EXPORT_LAST_LOGIN("export_last_login", true, false),
    BATCH_DELETE("batch_delete", false, true),
    BATCH_BLOCK("batch_block", false, true),
    BATCH_REVOKE_GRANTS("batch_revoke_grants", false, true),
    SOCIAL_UNLINK("social_unlink", false, true),
    CHECK_UNBLOCKED("check_unblocked", false, false),
    CHECK_DOMAINS("check_domains", false, false);

    private final String value;
    private final boolean requiresOutputFile;
    private final boolean destructive;

    OperationType(String value, boolean requiresOutputFile, boolean destructive) {
        this.value = value;
        this.requiresOutputFile = requiresOutputFile;
        this.destructive = destructive;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * True when the operation writes an artifact and therefore needs {@code output_file}.
     */
    public boolean requiresOutputFile() {
        return requiresOutputFile;
    }

    /**
     * True when the operation mutates remote state; such runs pace themselves conservatively.
     */
    public boolean destructive() {
        return destructive;
    }

    @JsonCreator
    public static OperationType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown operation type: " + value));
    }
}
