/**
 * Clock capability
 * =============================================================================
 *
 * <p>Consumers that need "the current time" depend on {@link com.questrail.timesource.api.Clock}
 * and receive it through their constructor. They never call an ambient time
 * source such as {@code Instant.now()} themselves.</p>
 *
 * <pre>
 *   production:  new Consumer(SystemClock.INSTANCE)
 *   tests:       new Consumer(FixedClock.parse("2023-01-01T09:00:00Z"))
 * </pre>
 *
 * <p>Wall-clock time lives here. Elapsed-time measurement lives in
 * {@code com.questrail.timesource.monotonic}.</p>
 */
package com.questrail.timesource.api;
