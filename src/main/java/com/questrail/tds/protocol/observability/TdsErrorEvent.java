package com.questrail.tds.protocol.observability;

import java.time.Instant;

/**
 * Record representing a fatal decode failure in a token stream parser.
 */
public record TdsErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
