package com.taxana.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evenly spaced permits for a public HTTP API shared by concurrent lookups.
 * Waiting for a permit delays the single attempt; it never repeats a call.
 */
public class RateLimiter {

    private static final long NANOS_PER_MINUTE = Duration.ofMinutes(1).toNanos();

    private final long spacingNanos;
    private final AtomicLong nextPermitAt = new AtomicLong(Long.MIN_VALUE);

    /**
     * @param permitsPerMinute e.g. 300 for the DexScreener public limit
     */
    public RateLimiter(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive: " + permitsPerMinute);
        }
        this.spacingNanos = NANOS_PER_MINUTE / permitsPerMinute;
    }

    public Duration getSpacing() {
        return Duration.ofNanos(spacingNanos);
    }

    /**
     * Reserves the next free slot and sleeps until it starts.
     *
     * @return how long the caller waited
     * @throws IllegalStateException if interrupted while waiting (interrupt flag is restored)
     */
    public Duration acquire() {
        long now = System.nanoTime();
        long previous = nextPermitAt.getAndUpdate(prev -> Math.max(prev, now) + spacingNanos);
        long waitNanos = Math.max(previous, now) - now;
        if (waitNanos <= 0) {
            return Duration.ZERO;
        }
        try {
            Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit permit", e);
        }
        return Duration.ofNanos(waitNanos);
    }
}
