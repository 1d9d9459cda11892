package com.questrail.tds.protocol.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>
 * The parser never waits or times out, so no monotonic clock is needed. Tests
 * substitute a fixed clock to make recorded events comparable.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Clock backed by {@link Instant#now()}; the parser default.
     */
    static WallClock system()
    {
        return Instant::now;
    }
}
