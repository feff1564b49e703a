package com.questrail.timesource.config;

import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ClockConfigTest
 * -----------------------------------------------------------------------------
 * Validates builder defaults, invariants and property parsing.
 */
class ClockConfigTest {

    private static Properties props(String... keyValues) {
        Properties p = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            p.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return p;
    }

    @Test
    void defaultsAreSystemClockInUtc() {
        ClockConfig config = ClockConfig.defaults();

        assertEquals(ClockMode.SYSTEM, config.mode());
        assertEquals(Optional.empty(), config.fixedInstant());
        assertEquals(ZoneOffset.UTC, config.zone());
    }

    @Test
    void fixedInstantImpliesFixedMode() {
        ClockConfig config = ClockConfig.builder()
            .withFixedInstant(Instant.parse("2023-01-01T09:00:00Z"))
            .build();

        assertEquals(ClockMode.FIXED, config.mode());
        assertEquals(Optional.of(Instant.parse("2023-01-01T09:00:00Z")), config.fixedInstant());
    }

    @Test
    void fixedModeWithoutInstantIsRejected() {
        assertThrows(ClockConfigurationException.class, () ->
            ClockConfig.builder().withMode(ClockMode.FIXED).build()
        );
    }

    @Test
    void systemModeWithInstantIsRejected() {
        assertThrows(ClockConfigurationException.class, () ->
            ClockConfig.builder()
                .withMode(ClockMode.SYSTEM)
                .withFixedInstant(Instant.parse("2023-01-01T09:00:00Z"))
                .build()
        );
    }

    @Test
    void canonicalConstructorRejectsNulls() {
        assertThrows(NullPointerException.class, () -> new ClockConfig(null, Optional.empty(), ZoneOffset.UTC));
        assertThrows(NullPointerException.class, () -> new ClockConfig(ClockMode.SYSTEM, null, ZoneOffset.UTC));
        assertThrows(NullPointerException.class, () -> new ClockConfig(ClockMode.SYSTEM, Optional.empty(), null));
    }

    @Test
    void emptyPropertiesGiveDefaults() {
        assertEquals(ClockConfig.defaults(), ClockConfig.fromProperties(new Properties()));
    }

    @Test
    void propertiesSelectFixedClock() {
        ClockConfig config = ClockConfig.fromProperties(props(
            ClockConfig.MODE_KEY, " FIXED ",
            ClockConfig.FIXED_INSTANT_KEY, "2023-01-01T15:00:00Z",
            ClockConfig.ZONE_KEY, "Europe/Berlin"
        ));

        assertEquals(ClockMode.FIXED, config.mode());
        assertEquals(Optional.of(Instant.parse("2023-01-01T15:00:00Z")), config.fixedInstant());
        assertEquals(ZoneId.of("Europe/Berlin"), config.zone());
    }

    @Test
    void modeValueIsCaseInsensitive() {
        assertEquals(ClockMode.SYSTEM,
            ClockConfig.fromProperties(props(ClockConfig.MODE_KEY, "System")).mode());
        assertEquals(ClockMode.FIXED, ClockConfig.fromProperties(props(
            ClockConfig.MODE_KEY, "fIxEd",
            ClockConfig.FIXED_INSTANT_KEY, "2023-01-01T09:00:00Z"
        )).mode());
    }

    @Test
    void instantPropertyAloneSelectsFixedClock() {
        ClockConfig config = ClockConfig.fromProperties(props(
            ClockConfig.FIXED_INSTANT_KEY, "2023-01-01T19:00:00Z"
        ));

        assertEquals(ClockMode.FIXED, config.mode());
    }

    @Test
    void blankValuesAreTreatedAsAbsent() {
        ClockConfig config = ClockConfig.fromProperties(props(
            ClockConfig.MODE_KEY, "  ",
            ClockConfig.FIXED_INSTANT_KEY, "",
            ClockConfig.ZONE_KEY, " "
        ));

        assertEquals(ClockConfig.defaults(), config);
    }

    @Test
    void unknownModeIsRejected() {
        ClockConfigurationException e = assertThrows(ClockConfigurationException.class, () ->
            ClockConfig.fromProperties(props(ClockConfig.MODE_KEY, "monotonic"))
        );
        assertTrue(e.getMessage().contains(ClockConfig.MODE_KEY));
    }

    @Test
    void malformedInstantIsRejectedWithCause() {
        ClockConfigurationException e = assertThrows(ClockConfigurationException.class, () ->
            ClockConfig.fromProperties(props(ClockConfig.FIXED_INSTANT_KEY, "yesterday"))
        );
        assertTrue(e.getMessage().contains(ClockConfig.FIXED_INSTANT_KEY));
        assertInstanceOf(DateTimeParseException.class, e.getCause());
    }

    @Test
    void unknownZoneIsRejectedWithCause() {
        ClockConfigurationException e = assertThrows(ClockConfigurationException.class, () ->
            ClockConfig.fromProperties(props(ClockConfig.ZONE_KEY, "Mars/Olympus"))
        );
        assertTrue(e.getMessage().contains(ClockConfig.ZONE_KEY));
        assertInstanceOf(DateTimeException.class, e.getCause());
    }

    @Test
    void explicitSystemModeWithInstantPropertyIsRejected() {
        assertThrows(ClockConfigurationException.class, () ->
            ClockConfig.fromProperties(props(
                ClockConfig.MODE_KEY, "system",
                ClockConfig.FIXED_INSTANT_KEY, "2023-01-01T09:00:00Z"
            ))
        );
    }
}
