package com.questrail.tds.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TdsObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTdsObservabilitySink implements TdsObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTdsObservabilitySink.class);

    @Override
    public void onTokenDecoded(TdsTokenEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("TDS Token: {} ({} bytes buffered)", event.tokenName(), event.bufferedBytes());
        }
    }

    @Override
    public void onSuspended(TdsSuspensionEvent event) {
        log.trace("TDS Parser suspended: need {} bytes, have {}",
            event.requiredBytes(),
            event.availableBytes());
    }

    @Override
    public void onResumed(TdsResumeEvent event) {
        log.trace("TDS Parser resumed with {} bytes", event.availableBytes());
    }

    @Override
    public void onError(TdsErrorEvent event) {
        log.error("TDS Decode Error: {}", event.message(), event.cause());
    }
}
