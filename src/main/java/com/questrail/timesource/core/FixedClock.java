package com.questrail.timesource.core;

import com.questrail.timesource.api.Clock;

import java.time.Instant;
import java.util.Objects;

/**
 * FixedClock
 * =============================================================================
 * {@link Clock} that always returns the instant it was created with.
 *
 * <p>
 * Intended for deterministic tests: each test case builds its own instance from
 * a literal instant and discards it afterwards. Instances are immutable, so two
 * fixed clocks never influence each other and one instance may be read from any
 * number of threads.
 * </p>
 *
 * <pre>
 *   Clock clock = FixedClock.parse("2023-01-01T15:00:00Z");
 *   clock.nowUtc().getHour();   // 15, on every call
 * </pre>
 */
public final class FixedClock implements Clock {

    private final Instant instant;

    private FixedClock(Instant instant) {
        this.instant = Objects.requireNonNull(instant, "instant");
    }

    /**
     * Creates a clock pinned to {@code instant}.
     */
    public static FixedClock at(Instant instant) {
        return new FixedClock(instant);
    }

    /**
     * Creates a clock pinned to an ISO-8601 instant such as {@code 2023-01-01T09:00:00Z}.
     *
     * @throws java.time.format.DateTimeParseException if the text is not an ISO-8601 instant
     */
    public static FixedClock parse(CharSequence isoInstant) {
        Objects.requireNonNull(isoInstant, "isoInstant");
        return new FixedClock(Instant.parse(isoInstant));
    }

    @Override
    public Instant now() {
        return instant;
    }

    public Instant instant() {
        return instant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FixedClock that)) return false;
        return instant.equals(that.instant);
    }

    @Override
    public int hashCode() {
        return instant.hashCode();
    }

    @Override
    public String toString() {
        return "FixedClock[" + instant + "]";
    }
}
