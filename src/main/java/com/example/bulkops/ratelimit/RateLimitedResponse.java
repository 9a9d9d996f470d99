package com.example.bulkops.ratelimit;

import java.util.List;
import java.util.Map;

/**
 * Status, headers and body of one outbound call, as seen by {@link RateGovernor#execute}.
 */
public record RateLimitedResponse<T>(int statusCode, Map<String, List<String>> headers, T body) {
    public static final int TOO_MANY_REQUESTS = 429;

    public RateLimitedResponse {
        headers = headers == null ? Map.of() : headers;
    }

    public boolean rateLimited() {
        return statusCode == TOO_MANY_REQUESTS;
    }
}
