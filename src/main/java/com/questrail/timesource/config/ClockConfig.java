package com.questrail.timesource.config;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Clock selection for a deployment.
 *
 * <h2>Property keys</h2>
 * <ul>
 *   <li>{@value #MODE_KEY}: {@code system} or {@code fixed}, case-insensitive, default {@code system}</li>
 *   <li>{@value #FIXED_INSTANT_KEY}: ISO-8601 instant, required for {@code fixed}</li>
 *   <li>{@value #ZONE_KEY}: zone id used for local-time views, default {@code UTC}</li>
 * </ul>
 */
public record ClockConfig(
    ClockMode mode,
    Optional<Instant> fixedInstant,
    ZoneId zone
) {
    public static final String MODE_KEY = "timesource.clock";
    public static final String FIXED_INSTANT_KEY = "timesource.fixed-instant";
    public static final String ZONE_KEY = "timesource.zone";

    public ClockConfig {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(fixedInstant, "fixedInstant");
        Objects.requireNonNull(zone, "zone");

        if (mode == ClockMode.FIXED && fixedInstant.isEmpty()) {
            throw new ClockConfigurationException("FIXED clock mode requires a fixed instant");
        }
        if (mode == ClockMode.SYSTEM && fixedInstant.isPresent()) {
            throw new ClockConfigurationException(
                "SYSTEM clock mode must not carry a fixed instant: " + fixedInstant.get());
        }
    }

    /**
     * System clock, UTC.
     */
    public static ClockConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from {@code properties}. Absent keys take their defaults.
     *
     * @throws ClockConfigurationException if a value cannot be interpreted
     */
    public static ClockConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();

        String mode = trimToNull(properties.getProperty(MODE_KEY));
        if (mode != null) {
            builder.withMode(parseMode(mode));
        }

        String instant = trimToNull(properties.getProperty(FIXED_INSTANT_KEY));
        if (instant != null) {
            try {
                builder.withFixedInstant(Instant.parse(instant));
            } catch (DateTimeParseException e) {
                throw new ClockConfigurationException(
                    "Invalid " + FIXED_INSTANT_KEY + ": '" + instant + "'", e);
            }
        }

        String zone = trimToNull(properties.getProperty(ZONE_KEY));
        if (zone != null) {
            try {
                builder.withZone(ZoneId.of(zone));
            } catch (DateTimeException e) {
                throw new ClockConfigurationException(
                    "Invalid " + ZONE_KEY + ": '" + zone + "'", e);
            }
        }

        return builder.build();
    }

    private static ClockMode parseMode(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "system" -> ClockMode.SYSTEM;
            case "fixed" -> ClockMode.FIXED;
            default -> throw new ClockConfigurationException(
                "Unknown " + MODE_KEY + ": '" + value + "' (expected system or fixed)");
        };
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private ClockMode mode;
        private Instant fixedInstant;
        private ZoneId zone = ZoneOffset.UTC;

        public Builder withMode(ClockMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Pins the clock to {@code instant}. Implies {@link ClockMode#FIXED} unless a mode is set.
         */
        public Builder withFixedInstant(Instant instant) {
            this.fixedInstant = instant;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public ClockConfig build() {
            ClockMode resolved = mode != null
                ? mode
                : (fixedInstant != null ? ClockMode.FIXED : ClockMode.SYSTEM);
            return new ClockConfig(resolved, Optional.ofNullable(fixedInstant), zone);
        }
    }
}
