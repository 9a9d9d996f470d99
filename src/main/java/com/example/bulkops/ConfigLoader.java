package com.example.bulkops;

import com.example.bulkops.checkpoint.CheckpointManager;
import com.example.bulkops.checkpoint.OperationConfig;
import com.example.bulkops.checkpoint.OperationType;
import com.example.bulkops.ratelimit.RateLimitSettings;
import com.example.bulkops.remote.EndpointDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class ConfigLoader {
    public static final String DEFAULT_TOKEN_VARIABLE = "BULK_OPS_API_TOKEN";
    private static final int DEFAULT_BATCH_SIZE = 50;
    private static final int DEFAULT_EXPORT_BUFFER_THRESHOLD = 100;
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public BulkOpsConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        Path checkpointDirectory = Optional.ofNullable(raw.checkpointDirectory)
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .orElse(CheckpointManager.DEFAULT_DIRECTORY);
        String environment = optionalString(raw.environment, OperationConfig.DEFAULT_ENVIRONMENT);
        if (raw.batchSize != null && raw.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + raw.batchSize);
        }
        int batchSize = raw.batchSize != null ? raw.batchSize : DEFAULT_BATCH_SIZE;
        int exportBufferThreshold = raw.exportBufferThreshold != null && raw.exportBufferThreshold > 0
                ? raw.exportBufferThreshold
                : DEFAULT_EXPORT_BUFFER_THRESHOLD;

        RawApi api = raw.api == null ? new RawApi() : raw.api;
        Optional<URI> baseUrl = Optional.ofNullable(api.baseUrl)
                .filter(value -> !value.isBlank())
                .map(ConfigLoader::parseBaseUrl);
        String tokenVariable = optionalString(api.tokenEnvironmentVariable, DEFAULT_TOKEN_VARIABLE);
        int timeoutSeconds = api.timeoutSeconds != null && api.timeoutSeconds > 0
                ? api.timeoutSeconds
                : DEFAULT_TIMEOUT_SECONDS;

        Optional<Pattern> itemPattern = Optional.ofNullable(raw.itemPattern)
                .filter(value -> !value.isBlank())
                .map(ConfigLoader::compile);

        return new BulkOpsConfig(
                checkpointDirectory,
                environment,
                batchSize,
                exportBufferThreshold,
                rateLimit(raw.rateLimit),
                baseUrl,
                tokenVariable,
                Duration.ofSeconds(timeoutSeconds),
                itemPattern,
                operations(raw.operations)
        );
    }

    private RateLimitSettings rateLimit(RawRateLimit raw) {
        RateLimitSettings defaults = RateLimitSettings.defaults();
        if (raw == null) {
            return defaults;
        }
        return new RateLimitSettings(
                millis(raw.minIntervalMillis, defaults.minInterval()),
                millis(raw.defaultIntervalMillis, defaults.defaultInterval()),
                millis(raw.cautiousIntervalMillis, defaults.cautiousInterval()),
                millis(raw.resetBufferMillis, defaults.resetBuffer()),
                millis(raw.initialBackoffMillis, defaults.initialBackoff()),
                raw.backoffMultiplier != null ? raw.backoffMultiplier : defaults.backoffMultiplier(),
                millis(raw.maxBackoffMillis, defaults.maxBackoff()),
                raw.jitterFactor != null ? raw.jitterFactor : defaults.jitterFactor(),
                raw.maxConsecutive429s != null ? raw.maxConsecutive429s : defaults.maxConsecutive429s(),
                raw.conservative != null && raw.conservative
        );
    }

    private Map<OperationType, EndpointDefinition> operations(Map<String, RawEndpoint> raw) throws JsonProcessingException {
        Map<OperationType, EndpointDefinition> operations = new EnumMap<>(OperationType.class);
        if (raw == null) {
            return Map.copyOf(operations);
        }
        for (Map.Entry<String, RawEndpoint> entry : raw.entrySet()) {
            OperationType type = OperationType.fromValue(entry.getKey());
            RawEndpoint endpoint = entry.getValue();
            if (endpoint == null) {
                throw new IllegalArgumentException("Operation " + entry.getKey() + " has no endpoint definition.");
            }
            String body = null;
            if (endpoint.body != null && !endpoint.body.isNull()) {
                body = endpoint.body.isTextual() ? endpoint.body.asText() : mapper.writeValueAsString(endpoint.body);
            }
            operations.put(type, new EndpointDefinition(endpoint.method, endpoint.path, body, endpoint.idField));
        }
        return Map.copyOf(operations);
    }

    private static URI parseBaseUrl(String value) {
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null
                    || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
                throw new IllegalArgumentException("api.baseUrl must be an absolute http(s) URL: " + value);
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("api.baseUrl is malformed: " + value, ex);
        }
    }

    private static Pattern compile(String value) {
        try {
            return Pattern.compile(value);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("itemPattern is not a valid regular expression: " + value, ex);
        }
    }

    private static Duration millis(Long value, Duration fallback) {
        return value != null && value >= 0 ? Duration.ofMillis(value) : fallback;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String checkpointDirectory;
        public String environment;
        public Integer batchSize;
        public Integer exportBufferThreshold;
        public RawRateLimit rateLimit;
        public RawApi api;
        public String itemPattern;
        public Map<String, RawEndpoint> operations;
    }

    private static class RawRateLimit {
        public Long minIntervalMillis;
        public Long defaultIntervalMillis;
        public Long cautiousIntervalMillis;
        public Long resetBufferMillis;
        public Long initialBackoffMillis;
        public Double backoffMultiplier;
        public Long maxBackoffMillis;
        public Double jitterFactor;
        public Integer maxConsecutive429s;
        public Boolean conservative;
    }

    private static class RawApi {
        public String baseUrl;
        public String tokenEnvironmentVariable;
        public Integer timeoutSeconds;
    }

    private static class RawEndpoint {
        public String method;
        public String path;
        public JsonNode body;
        public String idField;
    }
}
