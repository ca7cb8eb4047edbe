package com.kbengine.error;

public class RateLimitedException extends ProviderException {
    private final long retryAfterMs;

    public RateLimitedException(String providerName, long retryAfterMs) {
        super(providerName, "rate limit exceeded", true);
        this.retryAfterMs = retryAfterMs;
    }

    public long retryAfterMs() {
        return retryAfterMs;
    }
}
