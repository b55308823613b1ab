package net.moznion.dispatchq.backoff;

import lombok.Builder;
import lombok.Value;

/**
 * Delay between a failed attempt and the next one.
 * <p>
 * {@code FIXED} waits {@code baseDelayMillis} every time. {@code EXPONENTIAL} waits
 * {@code baseDelayMillis * factor^(attempt - 1)}, so with a 5 s base and factor 2 the retries
 * after attempts 1, 2 and 3 wait 5 s, 10 s and 20 s. A positive {@code maxDelayMillis} caps either strategy.
 */
@Value
@Builder
public class BackoffPolicy {
    private static final double DEFAULT_FACTOR = 2.0;

    BackoffStrategy strategy;
    long baseDelayMillis;
    double factor;
    long maxDelayMillis;

    public BackoffPolicy(final BackoffStrategy strategy,
                         final long baseDelayMillis,
                         final double factor,
                         final long maxDelayMillis) {
        if (strategy == null) {
            throw new IllegalArgumentException("backoff strategy is required");
        }
        if (baseDelayMillis < 0) {
            throw new IllegalArgumentException("baseDelayMillis must not be negative: " + baseDelayMillis);
        }
        if (strategy == BackoffStrategy.EXPONENTIAL && factor < 1.0) {
            throw new IllegalArgumentException("exponential factor must be >= 1: " + factor);
        }
        this.strategy = strategy;
        this.baseDelayMillis = baseDelayMillis;
        this.factor = factor;
        this.maxDelayMillis = maxDelayMillis;
    }

    public static BackoffPolicy fixed(final long delayMillis) {
        return new BackoffPolicy(BackoffStrategy.FIXED, delayMillis, 1.0, 0);
    }

    public static BackoffPolicy exponential(final long baseDelayMillis) {
        return exponential(baseDelayMillis, DEFAULT_FACTOR);
    }

    public static BackoffPolicy exponential(final long baseDelayMillis, final double factor) {
        return new BackoffPolicy(BackoffStrategy.EXPONENTIAL, baseDelayMillis, factor, 0);
    }

    public BackoffPolicy withMaxDelayMillis(final long maxDelayMillis) {
        return new BackoffPolicy(strategy, baseDelayMillis, factor, maxDelayMillis);
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     * @return milliseconds to wait before the job becomes visible again
     */
    public long delayFor(final int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1: " + attempt);
        }

        final double delay;
        if (strategy == BackoffStrategy.FIXED) {
            delay = baseDelayMillis;
        } else {
            delay = baseDelayMillis * Math.pow(factor, attempt - 1);
        }

        final double capped = maxDelayMillis > 0 ? Math.min(delay, maxDelayMillis) : delay;
        return capped >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) capped;
    }
}
