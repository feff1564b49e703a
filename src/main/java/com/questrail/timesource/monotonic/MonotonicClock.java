package com.questrail.timesource.monotonic;

import java.time.Duration;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for elapsed-time measurement.
 *
 * <h2>Binding invariant</h2>
 * Timeouts, backoff and duration measurement MUST use a monotonic source.
 * Wall-clock time ({@code Clock#now()}) answers "what time is it" and may jump;
 * it is not suitable for measuring intervals.
 *
 * <p>
 * Values carry no absolute meaning and are only comparable with other values
 * from the same clock.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     */
    long nowNanos();

    /**
     * Returns the time elapsed since {@code startNanos}, a value previously
     * obtained from {@link #nowNanos()} on this clock.
     */
    default Duration elapsedSince(long startNanos)
    {
        return Duration.ofNanos(nowNanos() - startNanos);
    }
}
