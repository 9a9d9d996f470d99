package com.example.bulkops.ratelimit;

/**
 * Fatal: the remote service kept rejecting calls with 429 and the run must stop rather than retry forever.
 */
public class RateLimitExceededException extends RuntimeException {
    private final int consecutiveRejections;

    public RateLimitExceededException(int consecutiveRejections) {
        super("Aborting after " + consecutiveRejections + " consecutive rate limit errors. "
                + "The API rate limit has been exceeded; wait and resume the operation later.");
        this.consecutiveRejections = consecutiveRejections;
    }

    public int consecutiveRejections() {
        return consecutiveRejections;
    }
}
