package com.questrail.timesource.config;

import com.questrail.timesource.api.Clock;
import com.questrail.timesource.core.FixedClock;
import com.questrail.timesource.core.SystemClock;
import com.questrail.timesource.interop.JavaTimeClocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the {@link Clock} a deployment is wired with.
 *
 * <p>Selection happens once, at wiring time. The returned clocks never log.</p>
 */
public final class ClockFactory {
    private static final Logger log = LoggerFactory.getLogger(ClockFactory.class);

    private ClockFactory() {}

    public static Clock create(ClockConfig config) {
        Objects.requireNonNull(config, "config");

        return switch (config.mode()) {
            case SYSTEM -> {
                log.info("Using system clock (zone {})", config.zone());
                yield SystemClock.INSTANCE;
            }
            case FIXED -> {
                FixedClock clock = FixedClock.at(config.fixedInstant().orElseThrow());
                log.warn("Using fixed clock pinned to {} (zone {}); time will not advance",
                    clock.instant(), config.zone());
                yield clock;
            }
        };
    }

    /**
     * Same selection as {@link #create(ClockConfig)}, exposed as a {@code java.time.Clock}
     * in the configured zone.
     */
    public static java.time.Clock createJavaClock(ClockConfig config) {
        return JavaTimeClocks.toJavaClock(create(config), config.zone());
    }
}
