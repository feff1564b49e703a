package com.questrail.timesource.interop;

import com.questrail.timesource.api.Clock;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Adapters between {@link Clock} and {@link java.time.Clock}.
 *
 * <p>Libraries and frameworks that expect a {@code java.time.Clock} (for example
 * {@code LocalDate.now(clock)}) can be handed a view over any {@link Clock}. The
 * view reads the underlying clock on every call and never caches.</p>
 */
public final class JavaTimeClocks {

    private JavaTimeClocks() {}

    /**
     * Returns a {@code java.time.Clock} in {@code zone} whose instant is read from {@code clock}.
     */
    public static java.time.Clock toJavaClock(Clock clock, ZoneId zone) {
        return new DelegatingJavaClock(clock, zone);
    }

    /**
     * Returns a {@link Clock} whose {@code now()} is {@code clock.instant()}.
     */
    public static Clock fromJavaClock(java.time.Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return clock::instant;
    }

    /**
     * {@code java.time.Clock} view over a {@link Clock}.
     */
    private static final class DelegatingJavaClock extends java.time.Clock {
        private final Clock delegate;
        private final ZoneId zone;

        private DelegatingJavaClock(Clock delegate, ZoneId zone) {
            this.delegate = Objects.requireNonNull(delegate, "clock");
            this.zone = Objects.requireNonNull(zone, "zone");
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public java.time.Clock withZone(ZoneId zone) {
            if (this.zone.equals(zone)) {
                return this;
            }
            return new DelegatingJavaClock(delegate, zone);
        }

        @Override
        public Instant instant() {
            return delegate.now();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DelegatingJavaClock that)) return false;
            return delegate.equals(that.delegate) && zone.equals(that.zone);
        }

        @Override
        public int hashCode() {
            return Objects.hash(delegate, zone);
        }

        @Override
        public String toString() {
            return "DelegatingJavaClock[" + delegate + "," + zone + "]";
        }
    }
}
