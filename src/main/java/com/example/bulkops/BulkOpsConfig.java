package com.example.bulkops;

import com.example.bulkops.checkpoint.OperationType;
import com.example.bulkops.ratelimit.RateLimitSettings;
import com.example.bulkops.remote.EndpointDefinition;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public record BulkOpsConfig(
        Path checkpointDirectory,
        String environment,
        int batchSize,
        int exportBufferThreshold,
        RateLimitSettings rateLimit,
        Optional<URI> apiBaseUrl,
        String tokenEnvironmentVariable,
        Duration apiTimeout,
        Optional<Pattern> itemPattern,
        Map<OperationType, EndpointDefinition> operations
) {
    public Optional<EndpointDefinition> endpointFor(OperationType operationType) {
        return Optional.ofNullable(operations.get(operationType));
    }

    public ItemValidator itemValidator() {
        return itemPattern.map(ItemValidator::matching).orElse(ItemValidator.nonBlank());
    }
}
