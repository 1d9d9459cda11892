package com.questrail.tds.protocol.observability;

import java.time.Instant;

/**
 * Record representing a parked read being retried after a chunk arrived.
 */
public record TdsResumeEvent(
    Instant timestamp,
    int availableBytes
) {
}
