package com.questrail.timesource.config;

/**
 * Indicates that clock configuration is missing, malformed or contradictory.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown clock mode</li>
 *   <li>A fixed-instant value that is not ISO-8601</li>
 *   <li>An unknown zone id</li>
 *   <li>A fixed mode without an instant, or a system mode with one</li>
 * </ul>
 */
public final class ClockConfigurationException extends RuntimeException
{
    public ClockConfigurationException(String message) {
        super(message);
    }

    public ClockConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
