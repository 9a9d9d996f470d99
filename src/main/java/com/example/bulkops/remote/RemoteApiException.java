package com.example.bulkops.remote;

import java.io.IOException;

/**
 * The remote API answered with a status that is neither success nor "not found".
 */
public class RemoteApiException extends IOException {
    private final int statusCode;
    private final String endpoint;

    public RemoteApiException(int statusCode, String endpoint, String detail) {
        super(endpoint + " returned HTTP " + statusCode + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.statusCode = statusCode;
        this.endpoint = endpoint;
    }

    public int statusCode() {
        return statusCode;
    }

    public String endpoint() {
        return endpoint;
    }
}
