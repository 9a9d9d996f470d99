package com.example.bulkops.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Settings a bulk operation was started with. Stored in the checkpoint so a resumed run uses the
 * original environment, files and flags rather than whatever the operator passes the second time.
 */
public record OperationConfig(
        @JsonProperty("environment") String environment,
        @JsonProperty("input_file") String inputFile,
        @JsonProperty("output_file") String outputFile,
        @JsonProperty("connection_filter") String connectionFilter,
        @JsonProperty("dry_run") boolean dryRun,
        @JsonProperty("auto_delete") boolean autoDelete,
        @JsonProperty("batch_size") Integer batchSize,
        @JsonProperty("operation_name") String operationName,
        @JsonProperty("extensions") Map<String, String> extensions
) {
    public static final String DEFAULT_ENVIRONMENT = "dev";

    public OperationConfig {
        environment = environment == null || environment.isBlank() ? DEFAULT_ENVIRONMENT : environment;
        extensions = extensions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static OperationConfig forEnvironment(String environment) {
        return new OperationConfig(environment, null, null, null, false, false, null, null, Map.of());
    }

    public Optional<String> outputFileIfSet() {
        return Optional.ofNullable(outputFile).filter(value -> !value.isBlank());
    }

    public OperationConfig withInputFile(String value) {
        return new OperationConfig(environment, value, outputFile, connectionFilter, dryRun, autoDelete,
                batchSize, operationName, extensions);
    }

    public OperationConfig withOutputFile(String value) {
        return new OperationConfig(environment, inputFile, value, connectionFilter, dryRun, autoDelete,
                batchSize, operationName, extensions);
    }

    public OperationConfig withDryRun(boolean value) {
        return new OperationConfig(environment, inputFile, outputFile, connectionFilter, value, autoDelete,
                batchSize, operationName, extensions);
    }

    public OperationConfig withBatchSize(Integer value) {
        return new OperationConfig(environment, inputFile, outputFile, connectionFilter, dryRun, autoDelete,
                value, operationName, extensions);
    }

    public OperationConfig withOperationName(String value) {
        return new OperationConfig(environment, inputFile, outputFile, connectionFilter, dryRun, autoDelete,
                batchSize, value, extensions);
    }

    public OperationConfig withExtension(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(extensions);
        merged.put(key, value);
        return new OperationConfig(environment, inputFile, outputFile, connectionFilter, dryRun, autoDelete,
                batchSize, operationName, merged);
    }
}
