package com.example.bulkops.ratelimit;

import java.io.IOException;

@FunctionalInterface
public interface RateLimitedCall<T> {
    RateLimitedResponse<T> call() throws IOException, InterruptedException;
}
