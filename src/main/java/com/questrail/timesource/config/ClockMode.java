package com.questrail.timesource.config;

/**
 * Which {@link com.questrail.timesource.api.Clock} variant a deployment wires in.
 */
public enum ClockMode {
    /** Host wall clock. */
    SYSTEM,
    /** A single pinned instant. */
    FIXED
}
