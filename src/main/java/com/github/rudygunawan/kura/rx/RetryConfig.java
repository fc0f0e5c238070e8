package com.github.rudygunawan.kura.rx;

import com.github.rudygunawan.kura.builder.CacheDefaults;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Backoff settings for {@link Rx#retryWithBackoff(io.reactivex.rxjava3.core.Observable, RetryConfig)}.
 *
 * <p>The delay before retry {@code n} (1-based) is
 * {@code min(initialDelay * multiplier^(n-1), maxDelay)}.
 */
public final class RetryConfig {
    private static final RetryConfig DEFAULT = new RetryConfig(CacheDefaults.RETRY_MAXIMUM_RETRIES,
            CacheDefaults.RETRY_INITIAL_DELAY, CacheDefaults.RETRY_MAXIMUM_DELAY,
            CacheDefaults.RETRY_MULTIPLIER, null);

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final Predicate<? super Throwable> retryIf;

    private RetryConfig(int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier,
                        Predicate<? super Throwable> retryIf) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        Objects.requireNonNull(initialDelay, "initialDelay cannot be null");
        Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays cannot be negative");
        }
        if (!(multiplier >= 1.0)) {
            throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
        }
        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.retryIf = retryIf;
    }

    public static RetryConfig of(int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier) {
        return new RetryConfig(maxRetries, initialDelay, maxDelay, multiplier, null);
    }

    /** 3 retries, 1 s initial delay, 30 s cap, doubling. */
    public static RetryConfig defaultConfig() {
        return DEFAULT;
    }

    /** 5 retries, 500 ms initial delay, 10 s cap, x1.5. */
    public static RetryConfig aggressive() {
        return of(5, Duration.ofMillis(500), Duration.ofSeconds(10), 1.5);
    }

    /** 2 retries, 2 s initial delay, 60 s cap, tripling. */
    public static RetryConfig conservative() {
        return of(2, Duration.ofSeconds(2), Duration.ofSeconds(60), 3.0);
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, initialDelay, maxDelay, multiplier, retryIf);
    }

    /**
     * Returns a copy that only retries errors accepted by {@code retryIf}; any other error
     * propagates at once.
     */
    public RetryConfig retryIf(Predicate<? super Throwable> retryIf) {
        Objects.requireNonNull(retryIf, "retryIf cannot be null");
        return new RetryConfig(maxRetries, initialDelay, maxDelay, multiplier, retryIf);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    /**
     * Returns the delay before retry {@code attempt}, counting from 1.
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive: " + attempt);
        }
        double nanos = initialDelay.toNanos() * Math.pow(multiplier, attempt - 1);
        long cap = maxDelay.toNanos();
        if (Double.isInfinite(nanos) || nanos >= cap) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    boolean shouldRetry(Throwable error, int attempt) {
        if (attempt > maxRetries) {
            return false;
        }
        return retryIf == null || retryIf.test(error);
    }

    @Override
    public String toString() {
        return "RetryConfig{maxRetries=" + maxRetries
                + ", initialDelay=" + initialDelay
                + ", maxDelay=" + maxDelay
                + ", multiplier=" + multiplier
                + (retryIf != null ? ", conditional" : "")
                + '}';
    }
}
