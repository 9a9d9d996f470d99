package com.example.bulkops.remote;

import com.example.bulkops.ItemOperation;
import com.example.bulkops.ItemOutcome;
import com.example.bulkops.JsonLinesWriter;
import com.example.bulkops.ratelimit.RateGovernor;
import com.example.bulkops.ratelimit.RateLimitedResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies one {@link EndpointDefinition} to each item over HTTP, paced by a {@link RateGovernor}.
 *
 * <p>2xx is success, 404 is "not found". A 2xx JSON array is a lookup result: empty means not
 * found, more than one element means the identifier was ambiguous. Any other status is raised as
 * {@link RemoteApiException} and recorded by the engine against the item.
 */
public class RemoteItemOperation implements ItemOperation {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteItemOperation.class);
    private static final int NOT_FOUND = 404;
    private static final int MAX_DETAIL_LENGTH = 200;

    private final HttpClient client;
    private final URI baseUri;
    private final String token;
    private final EndpointDefinition endpoint;
    private final RateGovernor governor;
    private final boolean dryRun;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final JsonLinesWriter<JsonNode> exportWriter;

    public RemoteItemOperation(HttpClient client,
                               URI baseUri,
                               String token,
                               EndpointDefinition endpoint,
                               RateGovernor governor,
                               boolean dryRun,
                               Duration timeout,
                               ObjectMapper mapper,
                               JsonLinesWriter<JsonNode> exportWriter) {
        this.client = client;
        this.baseUri = baseUri;
        this.token = token;
        this.endpoint = endpoint;
        this.governor = governor;
        this.dryRun = dryRun;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.exportWriter = exportWriter;
    }

    @Override
    public ItemOutcome process(String item) throws IOException, InterruptedException {
        if (dryRun && !endpoint.readOnly()) {
            LOGGER.info("[dry-run] would call {} {}", endpoint.method(), endpoint.resolvePath(item));
            return ItemOutcome.success();
        }
        HttpRequest request = buildRequest(item);
        RateLimitedResponse<String> response = governor.execute(() -> {
            HttpResponse<String> raw = client.send(request, HttpResponse.BodyHandlers.ofString());
            return new RateLimitedResponse<>(raw.statusCode(), raw.headers().map(), raw.body());
        });

        int status = response.statusCode();
        if (status == NOT_FOUND) {
            return ItemOutcome.notFound("HTTP 404");
        }
        if (status < 200 || status >= 300) {
            throw new RemoteApiException(status, endpoint.describe(), truncate(response.body()));
        }
        return interpret(item, response.body());
    }

    HttpRequest buildRequest(String item) {
        URI uri = URI.create(joinPath(baseUri.toString(), endpoint.resolvePath(item)));
        String body = endpoint.resolveBody(item);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json");
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json");
            builder.method(endpoint.method(), HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(endpoint.method(), HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private ItemOutcome interpret(String item, String body) throws IOException {
        if (body == null || body.isBlank()) {
            return ItemOutcome.success();
        }
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Non-JSON response for {}: {}", item, ex.getOriginalMessage());
            return ItemOutcome.success();
        }
        if (node.isArray()) {
            if (node.isEmpty()) {
                return ItemOutcome.notFound("no match");
            }
            if (node.size() > 1) {
                List<String> candidates = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    JsonNode id = element.get(endpoint.idField());
                    candidates.add(id != null && id.isValueNode() ? id.asText() : element.toString());
                }
                return ItemOutcome.multipleMatches(candidates);
            }
            node = node.get(0);
        }
        export(item, node);
        return ItemOutcome.success();
    }

    private void export(String item, JsonNode node) throws IOException {
        if (exportWriter == null) {
            return;
        }
        ObjectNode record = mapper.createObjectNode();
        record.put("item", item);
        record.set("response", node);
        exportWriter.add(record);
    }

    static String joinPath(String base, String path) {
        String left = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String right = path.startsWith("/") ? path : "/" + path;
        return left + right;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_DETAIL_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
