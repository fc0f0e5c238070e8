package com.github.rudygunawan.kura.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Every time-based component (memory cache expiry, the main-thread scheduler and the TTL
 * combinators) reads time through a {@code Ticker} so tests can drive it by hand instead of
 * sleeping.
 *
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 * Cache<String, byte[]> cache = CacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .build();
 *
 * cache.put("avatar", bytes, Duration.ofMillis(100));
 * ticker.advance(150, TimeUnit.MILLISECONDS);
 * cache.get("avatar");   // Optional.empty()
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Same contract as {@link System#nanoTime()}: monotonic, not related to wall-clock time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
