package io.pagesync.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential reconnection delay: {@code initial}, doubled per consecutive failure, capped at {@code max}.
 * Not thread-safe.
 */
public final class Backoff {

    public static final Duration DEFAULT_INITIAL = Duration.ofMillis(1000);
    public static final Duration DEFAULT_MAX = Duration.ofMillis(30_000);

    private final Duration initial;
    private final Duration max;
    private Duration current;
    private int attempts;

    public Backoff() {
        this(DEFAULT_INITIAL, DEFAULT_MAX);
    }

    public Backoff(Duration initial, Duration max) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.max = Objects.requireNonNull(max, "max");
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial must be > 0");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max must be >= initial");
        }
        this.current = initial;
    }

    /** Delay before the next attempt; advances the sequence. */
    public Duration next() {
        Duration d = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        attempts++;
        return d;
    }

    /** Back to {@code initial}; called after any successful open. */
    public void reset() {
        current = initial;
        attempts = 0;
    }

    /** Consecutive failures since the last reset. */
    public int attempts() {
        return attempts;
    }
}
