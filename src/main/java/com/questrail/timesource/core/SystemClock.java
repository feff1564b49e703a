package com.questrail.timesource.core;

import com.questrail.timesource.api.Clock;

import java.time.Instant;

/**
 * SystemClock
 * =============================================================================
 * Production {@link Clock} backed by {@link Instant#now()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Reads the host wall clock on every call</li>
 *   <li>May jump forward or backward due to NTP or manual adjustments</li>
 *   <li>Resolution depends on the platform, typically microseconds</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless. {@link Instant#now()} is safe for concurrent access.</p>
 */
public enum SystemClock implements Clock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public String toString() {
        return "SystemClock";
    }
}
