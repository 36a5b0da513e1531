package com.phillippitts.modelorchestrator.service.retry;

import com.phillippitts.modelorchestrator.config.properties.RetryProperties;

/**
 * Capped exponential backoff: {@code min(base * 2^(attemptIndex - 1), max)}.
 *
 * <p>With base 1000 and max 8000 the delays before attempts 1, 2, 3, 4, 5 are
 * 1000, 2000, 4000, 8000, 8000 ms. Attempt 0 never waits.
 */
public final class BackoffPolicy {

    private final long baseBackoffMs;
    private final long maxBackoffMs;

    public BackoffPolicy(long baseBackoffMs, long maxBackoffMs) {
        if (baseBackoffMs <= 0 || maxBackoffMs <= 0) {
            throw new IllegalArgumentException("Backoff bounds must be positive");
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("maxBackoffMs must be >= baseBackoffMs");
        }
        this.baseBackoffMs = baseBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public static BackoffPolicy from(RetryProperties properties) {
        return new BackoffPolicy(properties.baseBackoffMs(), properties.maxBackoffMs());
    }

    /**
     * @param attemptIndex zero-based index of the attempt about to start
     * @return delay to apply before that attempt
     */
    public long delayBeforeAttempt(int attemptIndex) {
        if (attemptIndex <= 0) {
            return 0;
        }
        int shift = attemptIndex - 1;
        // doubling past 62 bits overflows; the cap is reached long before
        if (shift >= 62 || baseBackoffMs > (maxBackoffMs >> shift)) {
            return maxBackoffMs;
        }
        return Math.min(baseBackoffMs << shift, maxBackoffMs);
    }
}
