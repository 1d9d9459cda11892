package com.questrail.tds.protocol.observability;

import com.questrail.tds.protocol.model.TdsToken;

import java.time.Instant;

/**
 * Record representing one completed token.
 *
 * @param bufferedBytes unconsumed bytes still held by the parser when the token completed
 */
public record TdsTokenEvent(
    Instant timestamp,
    TdsToken token,
    int bufferedBytes
) {
    /**
     * Short token name for log lines, e.g. {@code DoneToken}.
     */
    public String tokenName() {
        return token.getClass().getSimpleName();
    }
}
