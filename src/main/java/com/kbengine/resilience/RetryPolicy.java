package com.kbengine.resilience;

import java.io.IOException;
import java.io.InterruptedIOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbengine.error.KnowledgeEngineException;
import com.kbengine.error.RateLimitedException;

public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final String name;
    private final int maxAttempts;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double backoffFactor;
    private final Sleeper sleeper;

    public RetryPolicy(String name, int maxAttempts, long initialDelayMs, long maxDelayMs, double backoffFactor, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 for " + name);
        }
        if (initialDelayMs < 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("invalid retry delays for " + name);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1 for " + name);
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.backoffFactor = backoffFactor;
        this.sleeper = sleeper;
    }

    public <T> T execute(Attempt<T> attempt) throws IOException, InterruptedException {
        for (int current = 1; ; current++) {
            try {
                return attempt.run();
            } catch (InterruptedIOException e) {
                throw e;
            } catch (IOException e) {
                if (current >= maxAttempts) {
                    log.warn("retry.exhausted policy={} attempts={} reason={}", name, current, e.getMessage());
                    throw e;
                }
                backoff(current, e);
            } catch (KnowledgeEngineException e) {
                if (!e.retryable() || current >= maxAttempts) {
                    throw e;
                }
                backoff(current, e);
            }
        }
    }

    public long delayForAttempt(int attempt) {
        double delay = initialDelayMs * Math.pow(backoffFactor, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxDelayMs);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void backoff(int attempt, Exception cause) throws InterruptedException {
        long delay = delayForAttempt(attempt);
        if (cause instanceof RateLimitedException limited) {
            delay = Math.max(delay, limited.retryAfterMs());
        }
        log.warn("retry.backoff policy={} attempt={} maxAttempts={} backoffMs={} reason={}",
                name, attempt, maxAttempts, delay, cause.getMessage());
        if (delay > 0) {
            sleeper.sleep(delay);
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws IOException;
    }
}
