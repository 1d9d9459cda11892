package com.questrail.tds.protocol.observability;

import java.time.Instant;

/**
 * Record representing a parser parking a read because too few bytes are buffered.
 */
public record TdsSuspensionEvent(
    Instant timestamp,
    int requiredBytes,
    int availableBytes
) {
    public int missingBytes() {
        return requiredBytes - availableBytes;
    }
}
