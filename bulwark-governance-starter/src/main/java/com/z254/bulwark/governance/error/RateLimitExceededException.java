package com.z254.bulwark.governance.error;

import lombok.Getter;

/**
 * Admission was denied because the sliding window for the key is full.
 * Expected control flow: callers back off for {@link #getRetryAfter()} seconds.
 */
@Getter
public class RateLimitExceededException extends GovernanceException {

    private final String operation;
    private final String identity;
    private final long retryAfter;

    public RateLimitExceededException(String operation, String identity, long retryAfter) {
        super("Rate limit exceeded for " + operation + " by " + identity + ", retry after " + retryAfter + "s");
        this.operation = operation;
        this.identity = identity;
        this.retryAfter = retryAfter;
    }
}
