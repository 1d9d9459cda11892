package com.questrail.tds.protocol.observability;

/**
 * Main interface for receiving token stream parser observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run synchronously on the parsing thread and must not feed
 * input back into the parser.</p>
 */
public interface TdsObservabilitySink {
    /**
     * Called after a token completes, before it is handed to the listener.
     * @param event the token event
     */
    void onTokenDecoded(TdsTokenEvent event);

    /**
     * Called when a read parks waiting for more bytes.
     * @param event the suspension details
     */
    void onSuspended(TdsSuspensionEvent event);

    /**
     * Called when a parked read is retried on chunk arrival. The retry may
     * suspend again.
     * @param event the resume details
     */
    void onResumed(TdsResumeEvent event);

    /**
     * Called when decoding fails fatally.
     * @param event the error event
     */
    void onError(TdsErrorEvent event);
}
