package com.example.bulkops.remote;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * How one operation type maps onto the remote API. {@code {id}} in the path is replaced with the
 * URL-encoded identifier; in the body it is replaced with the JSON-escaped identifier.
 *
 * @param method  HTTP method, upper-cased
 * @param path    path relative to the API base URL
 * @param body    JSON body template, or null for no body
 * @param idField field read from each element of an array response to name the candidates
 */
public record EndpointDefinition(String method, String path, String body, String idField) {
    public static final String ID_PLACEHOLDER = "{id}";
    public static final String DEFAULT_ID_FIELD = "id";

    public EndpointDefinition {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (path == null || !path.contains(ID_PLACEHOLDER)) {
            throw new IllegalArgumentException("path must contain " + ID_PLACEHOLDER + ": " + path);
        }
        method = method.trim().toUpperCase(Locale.ROOT);
        idField = idField == null || idField.isBlank() ? DEFAULT_ID_FIELD : idField;
    }

    public static EndpointDefinition of(String method, String path) {
        return new EndpointDefinition(method, path, null, null);
    }

    public boolean readOnly() {
        return "GET".equals(method) || "HEAD".equals(method);
    }

    public String resolvePath(String item) {
        return path.replace(ID_PLACEHOLDER, URLEncoder.encode(item, StandardCharsets.UTF_8).replace("+", "%20"));
    }

    public String resolveBody(String item) {
        if (body == null) {
            return null;
        }
        return body.replace(ID_PLACEHOLDER, new String(JsonStringEncoder.getInstance().quoteAsString(item)));
    }

    String describe() {
        return method + " " + path;
    }
}
