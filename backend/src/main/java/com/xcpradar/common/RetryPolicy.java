package com.xcpradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter, shared by ledger HTTP retries and monitor startup.
 * Delays are capped at {@code maxDelayMs} so long outages do not produce multi-minute sleeps.
 */
public final class RetryPolicy {

    private static final long DEFAULT_MAX_DELAY_MS = 60_000L;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, DEFAULT_MAX_DELAY_MS);
    }

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
    }

    /**
     * Delay before the retry that follows the given zero-based failed attempt: base * 2^attempt, capped, then jittered.
     */
    public long delayMs(int attempt) {
        long exponential = attempt <= 0 ? baseDelayMs : baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    /**
     * Sleeps for {@link #delayMs(int)}. Restores the interrupt flag and fails if interrupted.
     */
    public void backoff(int attempt) {
        try {
            Thread.sleep(delayMs(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off", e);
        }
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, ±20% jitter, 5 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 5);
    }

    /**
     * No delay between attempts; for tests and in-process fakes.
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(0L, 0.0, maxAttempts, 0L);
    }
}
