package com.questrail.timesource.api;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Clock
 * =============================================================================
 * Capability for obtaining the current wall-clock instant.
 *
 * <p>
 * Components that depend on "the current time" receive a {@code Clock} through
 * their constructor rather than calling {@link Instant#now()} directly. Production
 * wiring supplies {@code SystemClock}; tests supply a {@code FixedClock} holding a
 * literal instant.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #now()} takes no arguments and never returns {@code null}</li>
 *   <li>There is no error path. A host that cannot supply time is an
 *       environment fault, not a condition of this interface</li>
 *   <li>No monotonicity or caching guarantee. Two reads within one logical
 *       operation may differ; consumers needing a single value read once</li>
 * </ul>
 *
 * <p>
 * Wall-clock time may jump under NTP or manual adjustment. Elapsed-time
 * measurement belongs to {@code MonotonicClock}.
 * </p>
 */
public interface Clock
{
    /**
     * Returns the current instant.
     */
    Instant now();

    /**
     * Returns the current instant as seen in the given zone.
     *
     * @param zone zone or offset used to resolve local fields such as hour-of-day
     */
    default ZonedDateTime now(ZoneId zone)
    {
        Objects.requireNonNull(zone, "zone");
        return now().atZone(zone);
    }

    /**
     * Returns the current instant at UTC.
     */
    default ZonedDateTime nowUtc()
    {
        return now(ZoneOffset.UTC);
    }
}
