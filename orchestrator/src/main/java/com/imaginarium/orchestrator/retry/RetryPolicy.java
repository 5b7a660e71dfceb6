package com.imaginarium.orchestrator.retry;

import com.imaginarium.orchestrator.node.ErrorClassification;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff with jitter for failed task attempts.
 *
 * <pre>
 *   delay(attempt) = min(maxDelay, baseDelay * 2^attempt + jitter),  jitter in [-baseDelay, +baseDelay]
 * </pre>
 *
 * {@code attempt} is the 1-based number of the attempt that just failed, so
 * the jitter band of one attempt never overlaps the band of the next.
 * Permanent failures are never retried.
 */
public class RetryPolicy {

    private final int      defaultMaxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;

    // Returns a value in [0, bound]; injectable so tests are deterministic.
    private final LongUnaryOperator random;

    public RetryPolicy(int defaultMaxRetries, Duration baseDelay, Duration maxDelay) {
        this(defaultMaxRetries, baseDelay, maxDelay,
                bound -> ThreadLocalRandom.current().nextLong(bound + 1));
    }

    public RetryPolicy(int defaultMaxRetries, Duration baseDelay, Duration maxDelay,
                       LongUnaryOperator random) {
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.defaultMaxRetries = defaultMaxRetries;
        this.baseDelay         = baseDelay;
        this.maxDelay          = maxDelay;
        this.random            = random;
    }

    public int defaultMaxRetries() { return defaultMaxRetries; }

    public RetryDecision decide(int attempt, int maxRetries, ErrorClassification classification) {
        if (classification == ErrorClassification.PERMANENT) {
            return RetryDecision.giveUp("permanent failure");
        }
        if (attempt > maxRetries) {
            return RetryDecision.giveUp("retries exhausted after " + attempt + " attempt(s)");
        }
        return RetryDecision.retryAfter(delayFor(attempt));
    }

    Duration delayFor(int attempt) {
        long base = baseDelay.toMillis();
        long max  = maxDelay.toMillis();
        if (base == 0) {
            return Duration.ZERO;
        }
        // 2^attempt overflows quickly; anything past the cap is the cap anyway.
        int shift = Math.min(Math.max(attempt, 0), 30);
        long exponential = base > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : base << shift;

        long jitter = random.applyAsLong(2 * base) - base;      // [-base, +base]
        long delay  = exponential >= max ? max : Math.min(max, exponential + jitter);
        return Duration.ofMillis(Math.max(0, delay));
    }
}
